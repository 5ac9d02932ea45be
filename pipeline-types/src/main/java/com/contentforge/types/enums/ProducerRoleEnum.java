package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symbolic producer roles referenced by plan steps.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum ProducerRoleEnum {

    RESEARCH("research"),
    BRIEF("brief"),
    DRAFT("draft"),
    VOICE_CHECK("voice-check"),
    FORMAT("format");

    private final String code;

    ProducerRoleEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
