package com.deepansh.explorer.core;

/**
 * Nudges chosen when a stuck loop is detected. None of them forces an action:
 * the agent sees the choice in the loop context and plans accordingly.
 */
public enum RecoveryStrategy {

    SWITCH_TO_DIRECTORY_SCAN("switch_to_directory_scan"),
    SWITCH_TO_FILE_SEARCH("switch_to_file_search"),
    TRY_LLM_REASONING("try_llm_reasoning"),
    /** Unrecoverable: the loop aborts */
    ESCALATE_TO_HUMAN("escalate_to_human");

    private final String value;

    RecoveryStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
