package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of plan step kinds. Workflow tables reference steps through these constants;
 * {@link #fromCode(String)} exists only for configured table overrides.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum StepTypeEnum {

    RESEARCH("research", "research"),
    BRIEF("brief", "content_brief"),
    DRAFT("draft", "creation"),
    VOICE_CHECK("voice-check", "brand_voice"),
    FORMAT("format", "production");

    private final String code;
    private final String alias;

    StepTypeEnum(String code, String alias) {
        this.code = code;
        this.alias = alias;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolve a configured step name.
     *
     * @return matching step, or {@code null} if the name is unknown
     */
    public static StepTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (StepTypeEnum type : StepTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(normalized)
                    || type.alias.equalsIgnoreCase(normalized)
                    || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        return null;
    }
}
