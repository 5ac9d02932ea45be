package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a tracked pipeline job.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum JobStatusEnum {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String code;

    JobStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public static JobStatusEnum fromRunStatus(RunStatusEnum runStatus) {
        if (runStatus == null) {
            return PENDING;
        }
        return switch (runStatus) {
            case PLANNED -> PENDING;
            case RUNNING -> RUNNING;
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case CANCELLED -> CANCELLED;
        };
    }
}
