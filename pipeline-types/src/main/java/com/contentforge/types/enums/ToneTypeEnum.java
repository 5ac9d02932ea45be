package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Voice and tone options.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum ToneTypeEnum {

    PROFESSIONAL("professional"),
    CONVERSATIONAL("conversational"),
    TECHNICAL("technical"),
    PERSUASIVE("persuasive"),
    EDUCATIONAL("educational"),
    INSPIRATIONAL("inspirational");

    private final String code;

    ToneTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ToneTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (ToneTypeEnum tone : ToneTypeEnum.values()) {
            if (tone.code.equalsIgnoreCase(normalized) || tone.name().equalsIgnoreCase(normalized)) {
                return tone;
            }
        }
        throw new IllegalArgumentException("Unknown tone: " + text);
    }
}
