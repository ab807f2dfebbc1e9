package com.deepansh.explorer.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of actions an agent can request from the tool executor.
 *
 * The wire value (snake_case) is what appears in traces, cache keys and the REST API.
 * Cacheable kinds are read-only repository operations whose results the executor
 * may serve from the agent's {@link com.deepansh.explorer.cache.ResultCache}.
 */
public enum ActionType {

    SCAN_DIRECTORY("scan_directory", true),
    LIST_FILES("list_files", true),
    READ_FILE("read_file", true),
    SEARCH_FILES("search_files", true),
    ANALYZE_CODE("analyze_code", true),
    LLM_REASONING("llm_reasoning", false),
    LLM_SUMMARY("llm_summary", false),
    CACHE_LOOKUP("cache_lookup", false),
    CACHE_STORE("cache_store", false);

    private final String value;
    private final boolean cacheable;

    ActionType(String value, boolean cacheable) {
        this.value = value;
        this.cacheable = cacheable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isCacheable() {
        return cacheable;
    }

    @JsonCreator
    public static ActionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown action type: " + value));
    }
}
