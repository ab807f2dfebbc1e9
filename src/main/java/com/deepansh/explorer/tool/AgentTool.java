package com.deepansh.explorer.tool;

import com.deepansh.explorer.model.ActionType;

import java.io.IOException;
import java.util.Map;

/**
 * Contract every tool must implement: {@code (parameters) -> result | error}.
 *
 * The result is opaque to the loop controller. Built-in tools return a
 * {@code Map<String, Object>} so the result validator and insight builder
 * can inspect well-known keys.
 *
 * Tools may throw. The {@link ToolExecutor} runs them on a worker thread,
 * applies the timeout and decides whether to retry.
 */
public interface AgentTool {

    /** The action kind this tool serves. One tool per kind. */
    ActionType getActionType();

    /** Human-readable description, shown in logs and LLM prompts */
    String getDescription();

    Object execute(Map<String, Object> parameters) throws IOException;
}
