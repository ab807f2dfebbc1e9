package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.llm.LlmClient;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.LlmResponse;
import com.deepansh.explorer.model.Message;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summarizes content with the LLM. Without one, the first non-blank lines become the key points.
 */
@Slf4j
public class LlmSummaryTool implements AgentTool {

    private static final int FALLBACK_KEY_POINTS = 3;

    private final LlmClient llmClient;

    /**
     * @param llmClient may be null, in which case every call uses the fallback summary
     */
    public LlmSummaryTool(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.LLM_SUMMARY;
    }

    @Override
    public String getDescription() {
        return "Summarize content with the LLM";
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String content = ToolParams.string(params, "content", "");
        String summaryType = ToolParams.string(params, "summary_type", "general");
        String focus = ToolParams.string(params, "focus", "all");

        if (llmClient == null || !llmClient.isAvailable()) {
            return fallback(content, summaryType, "LLM not configured");
        }

        try {
            LlmResponse response = llmClient.chat(List.of(
                    Message.system("Summarize the content below (" + summaryType + " summary, focus: " + focus
                            + "). Be concise."),
                    Message.user(content)));

            if (response.isFallback() || response.getContent() == null || response.getContent().isBlank()) {
                return fallback(content, summaryType, response.getContent());
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("summary", response.getContent());
            result.put("key_points", keyPoints(response.getContent()));
            result.put("confidence", 0.8);
            result.put("fallback", false);
            return result;

        } catch (RuntimeException e) {
            log.warn("LLM summary failed, using fallback: {}", e.getMessage());
            return fallback(content, summaryType, e.getMessage());
        }
    }

    private Map<String, Object> fallback(String content, String summaryType, String reason) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("summary", "Summary of " + summaryType + ": key findings from the analyzed content.");
        result.put("key_points", keyPoints(content));
        result.put("confidence", 0.5);
        result.put("fallback", true);
        result.put("fallback_reason", reason);
        return result;
    }

    static List<String> keyPoints(String text) {
        return Arrays.stream(text.split("\n"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .limit(FALLBACK_KEY_POINTS)
                .toList();
    }
}
