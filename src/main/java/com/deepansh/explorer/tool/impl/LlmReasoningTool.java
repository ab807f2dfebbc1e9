package com.deepansh.explorer.tool.impl;

import com.deepansh.explorer.llm.LlmClient;
import com.deepansh.explorer.model.ActionType;
import com.deepansh.explorer.model.LlmResponse;
import com.deepansh.explorer.model.Message;
import com.deepansh.explorer.tool.AgentTool;
import com.deepansh.explorer.tool.ToolParams;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Asks the LLM a question about the exploration so far.
 *
 * Falls back to a canned answer ({@code fallback=true}) when no LLM is configured,
 * the call fails, or the resilient client itself returned a fallback.
 */
@Slf4j
public class LlmReasoningTool implements AgentTool {

    private static final String SYSTEM_PROMPT = """
            You are assisting an autonomous agent that explores a code repository.
            Answer the question in a few sentences, then suggest the next action.
            """;

    private final LlmClient llmClient;
    private final String agentType;

    /**
     * @param llmClient may be null, in which case every call uses the fallback answer
     */
    public LlmReasoningTool(LlmClient llmClient, String agentType) {
        this.llmClient = llmClient;
        this.agentType = agentType;
    }

    @Override
    public ActionType getActionType() {
        return ActionType.LLM_REASONING;
    }

    @Override
    public String getDescription() {
        return "Reason about the current exploration state with the LLM";
    }

    @Override
    public Object execute(Map<String, Object> params) {
        String context = ToolParams.string(params, "context", "");
        String question = ToolParams.string(params, "question", "");
        String type = ToolParams.string(params, "agent_type", agentType);

        if (llmClient == null || !llmClient.isAvailable()) {
            return fallback(question, "LLM not configured");
        }

        try {
            LlmResponse response = llmClient.chat(List.of(
                    Message.system(SYSTEM_PROMPT),
                    Message.user("Agent: " + type + "\nContext:\n" + context + "\n\nQuestion: " + question)));

            if (response.isFallback() || response.getContent() == null || response.getContent().isBlank()) {
                return fallback(question, response.getContent());
            }

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("reasoning", response.getContent());
            result.put("confidence", 0.8);
            result.put("suggested_actions", List.of());
            result.put("fallback", false);
            return result;

        } catch (RuntimeException e) {
            log.warn("LLM reasoning failed, using fallback: {}", e.getMessage());
            return fallback(question, e.getMessage());
        }
    }

    private Map<String, Object> fallback(String question, String reason) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("reasoning", "Based on the context, I should focus on " + question);
        result.put("confidence", 0.5);
        result.put("suggested_actions", List.of("read_file", "search_files", "analyze_code"));
        result.put("fallback", true);
        result.put("fallback_reason", reason);
        return result;
    }
}
