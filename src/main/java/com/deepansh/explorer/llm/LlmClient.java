package com.deepansh.explorer.llm;

import com.deepansh.explorer.model.LlmResponse;
import com.deepansh.explorer.model.Message;

import java.util.List;

public interface LlmClient {

    /**
     * Send a short conversation (system + user) to the model.
     *
     * @param messages conversation so far
     * @return the model's text answer, or a fallback response when the provider is unreachable
     */
    LlmResponse chat(List<Message> messages);

    /**
     * False when the client cannot possibly succeed (e.g. no API key configured).
     * Callers use it to skip the call and go straight to their heuristic answer.
     */
    default boolean isAvailable() {
        return true;
    }
}
