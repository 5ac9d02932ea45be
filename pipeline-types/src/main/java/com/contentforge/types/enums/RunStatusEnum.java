package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one pipeline run.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum RunStatusEnum {

    /**
     * Plan built, no step invoked yet
     */
    PLANNED("planned"),

    /**
     * First step invoked
     */
    RUNNING("running"),

    /**
     * Every step attempted without a raised error
     */
    COMPLETED("completed"),

    /**
     * A producer raised, or strict mode promoted a gate failure
     */
    FAILED("failed"),

    /**
     * Aborted between steps through the cancellation signal
     */
    CANCELLED("cancelled");

    private final String code;

    RunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
