package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.repo.CodeRepository;
import com.deepansh.explorer.repo.RepositoryFile;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Basic structural statistics for a single source file.
 * Complexity is a rough estimate: one point per ten non-empty lines.
 */
public class AnalyzeCodeTool implements AgentTool {

    private static final Map<String, String> LANGUAGES = Map.ofEntries(
            Map.entry(".py", "python"),
            Map.entry(".js", "javascript"),
            Map.entry(".ts", "typescript"),
            Map.entry(".java", "java"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".c", "c"),
            Map.entry(".md", "markdown"),
            Map.entry(".yaml", "yaml"),
            Map.entry(".yml", "yaml"),
            Map.entry(".json", "json"));

    private final CodeRepository repository;

    public AnalyzeCodeTool(CodeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.ANALYZE_CODE;
    }

    @Override
    public String getDescription() {
        return "Analyze a source file: line counts, language, complexity estimate, key patterns";
    }

    @Override
    public Object execute(Map<String, Object> params) throws IOException {
        String filePath = ToolParams.string(params, "file_path", "");
        String content = repository.readFile(filePath);

        String[] lines = content.split("\n", -1);
        long nonEmpty = 0;
        for (String line : lines) {
            if (!line.isBlank()) {
                nonEmpty++;
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("file_path", filePath);
        result.put("analysis_type", ToolParams.string(params, "analysis_type", "basic"));
        result.put("total_lines", lines.length);
        result.put("non_empty_lines", nonEmpty);
        result.put("estimated_complexity", nonEmpty / 10);
        result.put("language", detectLanguage(filePath));
        result.put("key_patterns", keyPatterns(content));
        return result;
    }

    static String detectLanguage(String filePath) {
        String extension = new RepositoryFile(filePath, false, 0).extension();
        return LANGUAGES.getOrDefault(extension, "unknown");
    }

    static List<String> keyPatterns(String content) {
        List<String> patterns = new ArrayList<>();
        if (content.contains("class ")) {
            patterns.add("contains_classes");
        }
        if (content.contains("def ") || content.contains("function ")) {
            patterns.add("contains_functions");
        }
        if (content.contains("import ") || content.contains("from ")) {
            patterns.add("has_imports");
        }
        if (content.contains("TODO") || content.contains("FIXME")) {
            patterns.add("has_todos");
        }
        return patterns;
    }
}
