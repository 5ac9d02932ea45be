package com.contentforge.types.enums;

import lombok.Getter;

/**
 * Unified response / error codes.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Getter
public enum ResponseCode {

    /** Success */
    SUCCESS("0000", "success"),

    /** Unknown failure */
    UN_ERROR("0001", "unknown failure"),

    /** Illegal parameter, e.g. a malformed content request */
    ILLEGAL_PARAMETER("0002", "illegal parameter"),

    /** Unknown step name or unregistered producer role in the workflow table */
    PLAN_CONFIG_ERROR("1001", "plan configuration error"),

    /** Quality gate failure promoted to a run-ending error by strict mode */
    QUALITY_GATE_FAILED("1002", "quality gate failed"),

    /** Operational error raised by a producer */
    PRODUCER_ERROR("1003", "producer error"),

    /** Run aborted through its cancellation signal */
    RUN_CANCELLED("1004", "run cancelled"),

    /** No job is tracked under the given run id */
    JOB_NOT_FOUND("2001", "job not found");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
