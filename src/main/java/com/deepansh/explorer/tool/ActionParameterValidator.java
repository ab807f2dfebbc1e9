package com.deepansh.explorer.tool;

import com.deepansh.explorer.exception.ActionValidationException;
import com.deepansh.explorer.model.AgentAction;

import java.util.List;
import java.util.Map;

/**
 * Checks an action's parameters against the required fields of its kind
 * before any tool is invoked. Failures are never retried.
 */
public class ActionParameterValidator {

    public void validate(AgentAction action) {
        if (action.getType() == null) {
            throw new ActionValidationException("action type is required");
        }
        Map<String, Object> params = action.getParameters();

        switch (action.getType()) {
            case READ_FILE, ANALYZE_CODE -> requireNonEmptyString(params, "file_path", action);
            case SCAN_DIRECTORY, LIST_FILES -> {
                optionalString(params, "directory");
                optionalNonNegativeInteger(params, "max_depth");
            }
            case SEARCH_FILES -> {
                requireNonEmptyString(params, "pattern", action);
                Object fileTypes = params.get("file_types");
                if (fileTypes != null && !(fileTypes instanceof List<?>) && !(fileTypes instanceof String)) {
                    throw new ActionValidationException("file_types must be a list of extensions");
                }
            }
            case LLM_REASONING -> requireNonEmptyString(params, "question", action);
            case LLM_SUMMARY -> {
                if (!params.containsKey("content")) {
                    throw missing("content", action);
                }
            }
            case CACHE_LOOKUP, CACHE_STORE -> requireNonEmptyString(params, "key", action);
        }
    }

    private void requireNonEmptyString(Map<String, Object> params, String key, AgentAction action) {
        if (!params.containsKey(key)) {
            throw missing(key, action);
        }
        Object value = params.get(key);
        if (!(value instanceof String s) || s.isBlank()) {
            throw new ActionValidationException(key + " must be a non-empty string");
        }
    }

    private void optionalString(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value != null && !(value instanceof String)) {
            throw new ActionValidationException(key + " must be a string");
        }
    }

    private void optionalNonNegativeInteger(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value != null && (!(value instanceof Number number) || number.intValue() < 0)) {
            throw new ActionValidationException(key + " must be a non-negative integer");
        }
    }

    private ActionValidationException missing(String key, AgentAction action) {
        return new ActionValidationException(
                key + " parameter required for " + action.getType().name());
    }
}
