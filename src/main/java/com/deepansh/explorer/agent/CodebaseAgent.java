package com.deepansh.explorer.agent;

import com.deepansh.explorer.core.LoopState;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.Observation;
import com.deepansh.explorer.repo.RepositoryFile;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a repository's source code: languages, classes, functions, imports.
 *
 * Plan: scan the tree, read up to {@value #MAX_FILES_TO_READ} source files
 * (entry points first), run one goal-specific search, analyze each read file,
 * then summarize.
 */
@Slf4j
public class CodebaseAgent extends RepositoryAgent {

    static final int MAX_FILES_TO_READ = 5;

    private static final Map<String, String> SOURCE_LANGUAGES = Map.ofEntries(
            Map.entry(".py", "python"), Map.entry(".js", "javascript"), Map.entry(".ts", "typescript"),
            Map.entry(".java", "java"), Map.entry(".go", "go"), Map.entry(".rs", "rust"),
            Map.entry(".cpp", "cpp"), Map.entry(".c", "c"), Map.entry(".kt", "kotlin"),
            Map.entry(".rb", "ruby"), Map.entry(".cs", "csharp"));
    private static final List<String> SOURCE_TYPES = List.of(".py", ".js", ".ts", ".java");

    private static final Pattern CLASS_DEF = Pattern.compile("^\\s*(?:public\\s+|export\\s+)?(?:abstract\\s+)?class\\s+(\\w+)", Pattern.MULTILINE);
    private static final Pattern FUNCTION_DEF = Pattern.compile("^\\s*(?:async\\s+)?(?:def|function|func|fn)\\s+(\\w+)", Pattern.MULTILINE);
    private static final Pattern IMPORT = Pattern.compile("^\\s*(?:import|from)\\s+\\S+", Pattern.MULTILINE);

    private final Set<String> codeFiles = new LinkedHashSet<>();
    private final Map<String, FileAnalysis> analyzedFiles = new LinkedHashMap<>();
    private final Set<String> complexityChecked = new LinkedHashSet<>();
    private final Map<String, Integer> languageStats = new TreeMap<>();
    private final Set<ActionType> attempted = new LinkedHashSet<>();
    private boolean finished;

    record FileAnalysis(String language, int lines, List<String> classes, List<String> functions, int imports) {
    }

    @Override
    public String getName() {
        return "CodebaseAgent";
    }

    @Override
    public String reason(LoopState state) {
        if (!attempted.contains(ActionType.SCAN_DIRECTORY)) {
            return "Start by scanning the repository structure to find source code files.";
        }
        if (codeFiles.isEmpty()) {
            return "No source files found by the scan. List files by common extensions.";
        }
        if (analyzedFiles.size() < Math.min(MAX_FILES_TO_READ, codeFiles.size())) {
            return "Found " + codeFiles.size() + " source files, analyzed " + analyzedFiles.size()
                    + ". Read the most important ones next.";
        }
        return "Analyzed " + analyzedFiles.size() + " files. Look for patterns relevant to the goal and synthesize.";
    }

    @Override
    public AgentAction planAction(LoopState state, String reasoning) {
        if (!attempted.contains(ActionType.SCAN_DIRECTORY)) {
            return scanRepository("Scan repository for source code files");
        }
        if (codeFiles.isEmpty() && !attempted.contains(ActionType.LIST_FILES)) {
            return AgentAction.builder()
                    .type(ActionType.LIST_FILES)
                    .description("List Python source files")
                    .parameter("pattern", ".py")
                    .build();
        }

        String next = nextFileToRead();
        if (next != null && analyzedFiles.size() < MAX_FILES_TO_READ) {
            return readFile("Read source file", next, 500);
        }

        String goalPattern = goalSearchPattern(state.getGoal());
        if (goalPattern != null && !attempted.contains(ActionType.SEARCH_FILES)) {
            return search("Search source for '" + goalPattern.strip() + "'", goalPattern, SOURCE_TYPES, 20);
        }

        String unchecked = analyzedFiles.keySet().stream()
                .filter(path -> !complexityChecked.contains(path))
                .findFirst()
                .orElse(null);
        if (unchecked != null) {
            return AgentAction.builder()
                    .type(ActionType.ANALYZE_CODE)
                    .description("Analyze code complexity: " + unchecked)
                    .parameter("file_path", unchecked)
                    .parameter("analysis_type", "patterns")
                    .build();
        }

        if (!codeFiles.isEmpty() && !attempted.contains(ActionType.LLM_SUMMARY)) {
            return summarize("Summarize codebase findings", String.join("\n", state.getObservations()), "codebase");
        }

        return askLlm("Ask LLM for the next code analysis step", state.getCurrentContext(),
                "What should I analyze next for: " + state.getGoal() + "?");
    }

    @Override
    public void observe(LoopState state, Observation observation) {
        super.observe(state, observation);

        Object result = observation.getResult();
        String actionTaken = observation.getActionTaken() != null ? observation.getActionTaken() : "";
        if (observation.isSuccess() && result != null) {
            if (hasKey(result, "contents")) {
                attempted.add(ActionType.SCAN_DIRECTORY);
                listOf(result, "contents").stream()
                        .filter(item -> !Boolean.TRUE.equals(item.get("is_directory")))
                        .forEach(item -> addIfSource(String.valueOf(item.get("path"))));
            } else if (hasKey(result, "files")) {
                attempted.add(ActionType.LIST_FILES);
                listOf(result, "files").forEach(item -> addIfSource(String.valueOf(item.get("path"))));
            } else if (hasKey(result, "estimated_complexity")) {
                String path = stringOf(result, "file_path");
                complexityChecked.add(path);
                state.getCurrentContext().put("complexity:" + path, stringOf(result, "estimated_complexity"));
            } else if (hasKey(result, "content") && stringOf(result, "file_path") != null) {
                String path = stringOf(result, "file_path");
                analyzedFiles.put(path, analyze(path, stringOf(result, "content")));
                log.info("Analyzed source file: {}", path);
            } else if (hasKey(result, "results")) {
                attempted.add(ActionType.SEARCH_FILES);
                int matches = listOf(result, "results").size();
                state.getCurrentContext().put("goal_search_hits", matches);
            } else if (hasKey(result, "summary")) {
                attempted.add(ActionType.LLM_SUMMARY);
                state.getCurrentContext().put("codebase_summary", result instanceof Map<?, ?> m ? m.get("summary") : null);
                markFinished(state, "Codebase analysis " + COMPLETION_MARKER + " for " + analyzedFiles.size() + " files");
            }
        } else if (!observation.isSuccess()) {
            // never retry a file that failed once
            if (actionTaken.startsWith("Read source file: ")) {
                analyzedFiles.putIfAbsent(actionTaken.substring("Read source file: ".length()),
                        new FileAnalysis("unreadable", 0, List.of(), List.of(), 0));
            } else if (actionTaken.startsWith("Analyze code complexity: ")) {
                complexityChecked.add(actionTaken.substring("Analyze code complexity: ".length()));
            }
        }

        if (attempted.contains(ActionType.SCAN_DIRECTORY) && attempted.contains(ActionType.LIST_FILES)
                && codeFiles.isEmpty()) {
            markFinished(state, "No source code found, analysis " + COMPLETION_MARKER);
        }
        state.getCurrentContext().put("code_files_found", codeFiles.size());
        state.getCurrentContext().put("code_files_analyzed", analyzedFiles.size());
    }

    @Override
    public String generateSummary(LoopState state) {
        if (codeFiles.isEmpty()) {
            return "No source code files found in the repository.";
        }

        int classes = 0;
        int functions = 0;
        for (FileAnalysis analysis : analyzedFiles.values()) {
            classes += analysis.classes().size();
            functions += analysis.functions().size();
        }

        StringBuilder summary = new StringBuilder("Codebase analysis summary:\n");
        summary.append("- Found ").append(codeFiles.size()).append(" source code files\n");
        summary.append("- Analyzed ").append(analyzedFiles.size()).append(" files in detail\n");
        summary.append("- Extracted ").append(classes).append(" classes and ").append(functions).append(" functions\n");

        List<String> languages = new ArrayList<>();
        languageStats.forEach((language, count) -> languages.add(language + "(" + count + ")"));
        summary.append("- Languages: ").append(String.join(", ", languages)).append('\n');

        if (state.getCacheHits() > 0) {
            summary.append("- Cache hits: ").append(state.getCacheHits()).append('\n');
        }
        if (state.getErrorCount() > 0) {
            summary.append("- Errors encountered: ").append(state.getErrorCount()).append('\n');
        }
        return summary.toString().trim();
    }

    Set<String> getCodeFiles() {
        return codeFiles;
    }

    Map<String, FileAnalysis> getAnalyzedFiles() {
        return analyzedFiles;
    }

    Map<String, Integer> getLanguageStats() {
        return languageStats;
    }

    private void markFinished(LoopState state, String insight) {
        if (!finished) {
            finished = true;
            state.getObservations().add(insight);
        }
    }

    private String nextFileToRead() {
        return codeFiles.stream()
                .filter(path -> !analyzedFiles.containsKey(path))
                .min((a, b) -> Boolean.compare(!isEntryPoint(a), !isEntryPoint(b)))
                .orElse(null);
    }

    private void addIfSource(String path) {
        String language = languageOf(path);
        if (language != null && codeFiles.add(path)) {
            languageStats.merge(language, 1, Integer::sum);
            log.debug("Found source file: {}", path);
        }
    }

    static String languageOf(String path) {
        return SOURCE_LANGUAGES.get(new RepositoryFile(path, false, 0).extension());
    }

    private static boolean isEntryPoint(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return lower.contains("main") || lower.contains("__init__") || lower.contains("app");
    }

    static String goalSearchPattern(String goal) {
        String lower = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        if (lower.contains("api")) return "api";
        if (lower.contains("class")) return "class ";
        if (lower.contains("function")) return "def ";
        if (lower.contains("import") || lower.contains("dependenc")) return "import ";
        if (lower.contains("test")) return "test";
        return null;
    }

    static FileAnalysis analyze(String path, String content) {
        return new FileAnalysis(languageOf(path), content.split("\n", -1).length,
                names(CLASS_DEF, content), names(FUNCTION_DEF, content), count(IMPORT, content));
    }

    private static List<String> names(Pattern pattern, String content) {
        List<String> names = new ArrayList<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private static int count(Pattern pattern, String content) {
        int count = 0;
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
