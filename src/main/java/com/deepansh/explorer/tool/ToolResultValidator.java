package com.deepansh.explorer.tool;

import com.deepansh.explorer.exception.ResultValidationException;
import com.deepansh.explorer.model.ActionType;

import java.util.Map;

/**
 * Sanity checks on tool results. A failed check makes the executor retry the call.
 */
public class ToolResultValidator {

    public void validate(ActionType type, Object result) {
        if (result == null) {
            throw new ResultValidationException("Tool returned no result");
        }
        if (!(result instanceof Map<?, ?> map)) {
            return;
        }
        if (map.containsKey("error")) {
            throw new ResultValidationException("Tool returned error: " + map.get("error"));
        }

        switch (type) {
            case READ_FILE -> {
                if (!map.containsKey("content")) {
                    throw new ResultValidationException("READ_FILE result missing content");
                }
                Object content = map.get("content");
                if (content == null || content.toString().isEmpty()) {
                    throw new ResultValidationException("READ_FILE returned empty content");
                }
            }
            case SCAN_DIRECTORY -> requireKey(map, "contents", type);
            case LIST_FILES -> requireKey(map, "files", type);
            case SEARCH_FILES -> requireKey(map, "results", type);
            default -> {
                // no kind-specific shape
            }
        }
    }

    private void requireKey(Map<?, ?> map, String key, ActionType type) {
        if (!map.containsKey(key)) {
            throw new ResultValidationException(type.name() + " result missing " + key);
        }
    }
}
