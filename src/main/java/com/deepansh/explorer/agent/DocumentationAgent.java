package com.deepansh.explorer.agent;

import com.deepansh.explorer.core.LoopState;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.Observation;
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
 * Finds and reads a repository's documentation.
 *
 * Plan: scan the tree, fall back to listing markdown files, read up to
 * {@value #MAX_DOCS_TO_READ} documents (READMEs first), run one goal-specific
 * search when the goal asks for api/architecture/install docs, then summarize.
 */
@Slf4j
public class DocumentationAgent extends RepositoryAgent {

    static final int MAX_DOCS_TO_READ = 3;
    private static final List<String> DOC_EXTENSIONS = List.of(".md", ".rst", ".txt", ".adoc", ".wiki");
    private static final List<String> DOC_KEYWORDS = List.of("doc", "readme", "manual", "guide", "help",
            "license", "changelog", "contributing");
    private static final Pattern CODE_FENCE = Pattern.compile("```");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]*)\\]\\(([^)]*)\\)");

    private final Set<String> foundDocs = new LinkedHashSet<>();
    private final Map<String, DocAnalysis> analyzedDocs = new LinkedHashMap<>();
    private final Set<ActionType> attempted = new LinkedHashSet<>();
    private boolean finished;

    record DocAnalysis(String type, int headings, int codeBlocks, int links, int words, int completeness) {
    }

    @Override
    public String getName() {
        return "DocumentationAgent";
    }

    @Override
    public String reason(LoopState state) {
        if (!attempted.contains(ActionType.SCAN_DIRECTORY)) {
            return "Start by scanning the repository structure to identify documentation files.";
        }
        if (foundDocs.isEmpty()) {
            return "No documentation found yet. Look for common documentation patterns.";
        }
        if (analyzedDocs.isEmpty()) {
            return "Found " + foundDocs.size() + " documentation files. Read the most important ones, README first.";
        }
        if (analyzedDocs.size() < Math.min(MAX_DOCS_TO_READ, foundDocs.size())) {
            return "Analyzed " + analyzedDocs.size() + " documents, keep reading for more depth.";
        }
        return "Analyzed " + analyzedDocs.size() + " documents. Look for goal-specific details and synthesize.";
    }

    @Override
    public AgentAction planAction(LoopState state, String reasoning) {
        if (!attempted.contains(ActionType.SCAN_DIRECTORY)) {
            return scanRepository("Scan repository for documentation files");
        }
        if (foundDocs.isEmpty() && !attempted.contains(ActionType.LIST_FILES)) {
            return AgentAction.builder()
                    .type(ActionType.LIST_FILES)
                    .description("List markdown files")
                    .parameter("pattern", ".md")
                    .parameter("directory", ".")
                    .build();
        }

        String next = nextDocToRead();
        if (next != null && analyzedDocs.size() < MAX_DOCS_TO_READ) {
            return readFile("Read documentation file", next, 200);
        }

        String goalPattern = goalSearchPattern(state.getGoal());
        if (goalPattern != null && !attempted.contains(ActionType.SEARCH_FILES)) {
            return search("Search documentation for '" + goalPattern + "'", goalPattern,
                    List.of(".md", ".rst", ".txt"), 10);
        }

        if (!foundDocs.isEmpty() && !attempted.contains(ActionType.LLM_SUMMARY)) {
            return summarize("Summarize documentation findings", String.join("\n", state.getObservations()),
                    "documentation");
        }

        return askLlm("Ask LLM for the next documentation step", state.getCurrentContext(),
                "What should I analyze next for: " + state.getGoal() + "?");
    }

    @Override
    public void observe(LoopState state, Observation observation) {
        super.observe(state, observation);

        Object result = observation.getResult();
        if (observation.isSuccess() && result != null) {
            if (hasKey(result, "contents")) {
                attempted.add(ActionType.SCAN_DIRECTORY);
                listOf(result, "contents").stream()
                        .filter(item -> !Boolean.TRUE.equals(item.get("is_directory")))
                        .map(item -> String.valueOf(item.get("path")))
                        .forEach(this::addIfDocumentation);
            } else if (hasKey(result, "files")) {
                attempted.add(ActionType.LIST_FILES);
                listOf(result, "files").forEach(item -> addIfDocumentation(String.valueOf(item.get("path"))));
            } else if (hasKey(result, "content") && stringOf(result, "file_path") != null) {
                String path = stringOf(result, "file_path");
                analyzedDocs.put(path, analyze(path, stringOf(result, "content")));
                log.info("Analyzed documentation: {}", path);
            } else if (hasKey(result, "results")) {
                attempted.add(ActionType.SEARCH_FILES);
                listOf(result, "results").forEach(hit -> foundDocs.add(String.valueOf(hit.get("file_path"))));
            } else if (hasKey(result, "summary")) {
                attempted.add(ActionType.LLM_SUMMARY);
                state.getCurrentContext().put("documentation_summary", result instanceof Map<?, ?> m ? m.get("summary") : null);
                markFinished(state, "Documentation analysis " + COMPLETION_MARKER + " for " + analyzedDocs.size() + " files");
            }
        } else if (!observation.isSuccess() && observation.getActionTaken() != null
                && observation.getActionTaken().startsWith("Read documentation file: ")) {
            // unreadable document: skip it next time
            String path = observation.getActionTaken().substring("Read documentation file: ".length());
            analyzedDocs.putIfAbsent(path, new DocAnalysis("unreadable", 0, 0, 0, 0, 0));
        }

        if (attempted.contains(ActionType.SCAN_DIRECTORY) && attempted.contains(ActionType.LIST_FILES)
                && foundDocs.isEmpty()) {
            markFinished(state, "No documentation found, analysis " + COMPLETION_MARKER);
        }
        state.getCurrentContext().put("docs_found", foundDocs.size());
        state.getCurrentContext().put("docs_analyzed", analyzedDocs.size());
    }

    @Override
    public String generateSummary(LoopState state) {
        if (foundDocs.isEmpty()) {
            return "No documentation files found in the repository.";
        }

        StringBuilder summary = new StringBuilder("Documentation analysis summary:\n");
        summary.append("- Found ").append(foundDocs.size()).append(" documentation files\n");
        summary.append("- Analyzed ").append(analyzedDocs.size()).append(" files in detail\n");

        Map<String, Integer> types = new TreeMap<>();
        analyzedDocs.values().forEach(a -> types.merge(a.type(), 1, Integer::sum));
        if (!types.isEmpty()) {
            List<String> parts = new ArrayList<>();
            types.forEach((type, count) -> parts.add(type + "(" + count + ")"));
            summary.append("- Document types: ").append(String.join(", ", parts)).append('\n');
        }
        analyzedDocs.forEach((path, a) -> {
            if (!"unreadable".equals(a.type())) {
                summary.append("- ").append(path).append(": ").append(a.headings()).append(" sections, ")
                        .append(a.codeBlocks()).append(" code examples, completeness ")
                        .append(a.completeness()).append("/4\n");
            }
        });
        if (state.getCacheHits() > 0) {
            summary.append("- Cache hits: ").append(state.getCacheHits()).append('\n');
        }
        if (state.getErrorCount() > 0) {
            summary.append("- Errors encountered: ").append(state.getErrorCount()).append('\n');
        }
        return summary.toString().trim();
    }

    Set<String> getFoundDocs() {
        return foundDocs;
    }

    Map<String, DocAnalysis> getAnalyzedDocs() {
        return analyzedDocs;
    }

    private void markFinished(LoopState state, String insight) {
        if (!finished) {
            finished = true;
            state.getObservations().add(insight);
        }
    }

    private String nextDocToRead() {
        return foundDocs.stream()
                .filter(path -> !analyzedDocs.containsKey(path))
                .min((a, b) -> Boolean.compare(!isReadme(a), !isReadme(b)))
                .orElse(null);
    }

    private void addIfDocumentation(String path) {
        if (isDocumentation(path) && foundDocs.add(path)) {
            log.debug("Found documentation: {}", path);
        }
    }

    static boolean isDocumentation(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        return DOC_EXTENSIONS.stream().anyMatch(lower::endsWith)
                || DOC_KEYWORDS.stream().anyMatch(lower::contains);
    }

    private static boolean isReadme(String path) {
        return path.toLowerCase(Locale.ROOT).contains("readme");
    }

    static String goalSearchPattern(String goal) {
        String lower = goal == null ? "" : goal.toLowerCase(Locale.ROOT);
        if (lower.contains("api")) {
            return "api";
        }
        if (lower.contains("architecture")) {
            return "architecture";
        }
        if (lower.contains("install") || lower.contains("setup")) {
            return "install";
        }
        return null;
    }

    static DocAnalysis analyze(String path, String content) {
        String lowerPath = path.toLowerCase(Locale.ROOT);
        String lower = content.toLowerCase(Locale.ROOT);

        int headings = 0;
        for (String line : content.split("\n")) {
            if (line.strip().startsWith("#")) {
                headings++;
            }
        }
        int fences = 0;
        Matcher fence = CODE_FENCE.matcher(content);
        while (fence.find()) {
            fences++;
        }
        int links = 0;
        Matcher link = MARKDOWN_LINK.matcher(content);
        while (link.find()) {
            links++;
        }
        String trimmed = content.strip();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        int completeness = 0;
        if (lower.contains("install")) completeness++;
        if (lower.contains("usage") || lower.contains("example")) completeness++;
        if (lower.contains("api")) completeness++;
        if (lower.contains("architecture") || lower.contains("design")) completeness++;

        return new DocAnalysis(classify(lowerPath, lower), headings, fences / 2, links, words, completeness);
    }

    private static String classify(String lowerPath, String lowerContent) {
        if (lowerPath.contains("readme")) return "readme";
        if (lowerPath.contains("api") || lowerContent.contains("api")) return "api";
        if (lowerPath.contains("architecture") || lowerContent.contains("architecture")) return "architecture";
        if (lowerPath.contains("install") || lowerContent.contains("setup")) return "installation";
        if (lowerPath.contains("usage") || lowerContent.contains("example")) return "usage";
        if (lowerPath.contains("contributing")) return "contributing";
        if (lowerPath.contains("changelog")) return "changelog";
        if (lowerPath.contains("license")) return "license";
        return "general";
    }
}
