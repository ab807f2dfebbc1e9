package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.repo.CodeRepository;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a repository file, keeping at most {@code max_lines} lines (default 100).
 * {@code line_count} is always the full line count of the file.
 */
@Slf4j
public class ReadFileTool implements AgentTool {

    static final int DEFAULT_MAX_LINES = 100;

    private final CodeRepository repository;

    public ReadFileTool(CodeRepository repository) {
        this.repository = repository;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.READ_FILE;
    }

    @Override
    public String getDescription() {
        return "Read the content of a file, truncated to max_lines lines";
    }

    @Override
    public Object execute(Map<String, Object> params) throws IOException {
        String filePath = ToolParams.string(params, "file_path", "");
        int maxLines = ToolParams.integer(params, "max_lines", DEFAULT_MAX_LINES);

        String content = repository.readFile(filePath);
        String[] lines = content.split("\n", -1);

        boolean truncated = lines.length > maxLines;
        if (truncated) {
            content = String.join("\n", Arrays.copyOf(lines, Math.max(0, maxLines)));
        }
        log.debug("Read file: {} ({} lines{})", filePath, lines.length, truncated ? ", truncated" : "");

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("file_path", filePath);
        result.put("content", content);
        result.put("line_count", lines.length);
        result.put("truncated", truncated);
        result.put("size", content.length());
        return result;
    }
}
