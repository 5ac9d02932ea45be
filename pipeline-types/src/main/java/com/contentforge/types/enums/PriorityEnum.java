package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Request priority tag.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum PriorityEnum {

    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String code;

    PriorityEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static PriorityEnum fromCode(String code) {
        if (code == null || code.trim().isEmpty()) {
            return NORMAL;
        }
        for (PriorityEnum priority : PriorityEnum.values()) {
            if (priority.code.equalsIgnoreCase(code.trim())) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority code: " + code);
    }
}
