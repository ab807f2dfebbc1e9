package com.deepansh.explorer.agent;

import com.deepansh.explorer.core.ExplorationAgent;
import com.deepansh.explorer.model.AgentAction;
import com.deepansh.explorer.model.ActionType;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Base for the built-in agents that explore a code repository through the built-in tools.
 *
 * Instances keep per-run discoveries and must not be reused across loops.
 */
public abstract class RepositoryAgent implements ExplorationAgent {

    /** Marker the default goal heuristic picks up */
    protected static final String COMPLETION_MARKER = "completed";

    protected static AgentAction scanRepository(String description) {
        return AgentAction.builder()
                .type(ActionType.SCAN_DIRECTORY)
                .description(description)
                .parameter("directory", ".")
                .parameter("max_depth", 3)
                .expectedOutcome("Repository layout")
                .build();
    }

    protected static AgentAction readFile(String description, String path, int maxLines) {
        return AgentAction.builder()
                .type(ActionType.READ_FILE)
                .description(description + ": " + path)
                .parameter("file_path", path)
                .parameter("max_lines", maxLines)
                .build();
    }

    protected static AgentAction search(String description, String pattern, List<String> fileTypes, int maxResults) {
        return AgentAction.builder()
                .type(ActionType.SEARCH_FILES)
                .description(description)
                .parameter("pattern", pattern)
                .parameter("file_types", fileTypes)
                .parameter("max_results", maxResults)
                .build();
    }

    protected static AgentAction summarize(String description, String content, String summaryType) {
        return AgentAction.builder()
                .type(ActionType.LLM_SUMMARY)
                .description(description)
                .parameter("content", content)
                .parameter("summary_type", summaryType)
                .build();
    }

    protected static AgentAction askLlm(String description, Map<String, Object> context, String question) {
        return AgentAction.builder()
                .type(ActionType.LLM_REASONING)
                .description(description)
                .parameter("context", String.valueOf(context))
                .parameter("question", question)
                .build();
    }

    @SuppressWarnings("unchecked")
    protected static List<Map<String, Object>> listOf(Object result, String key) {
        if (result instanceof Map<?, ?> map && map.get(key) instanceof List<?> list) {
            return (List<Map<String, Object>>) list;
        }
        return Collections.emptyList();
    }

    protected static String stringOf(Object result, String key) {
        if (result instanceof Map<?, ?> map && map.get(key) != null) {
            return map.get(key).toString();
        }
        return null;
    }

    protected static boolean hasKey(Object result, String key) {
        return result instanceof Map<?, ?> map && map.containsKey(key);
    }
}
