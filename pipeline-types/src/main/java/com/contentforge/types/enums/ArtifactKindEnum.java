package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of artifacts flowing between steps.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum ArtifactKindEnum {

    /**
     * The original request; input of the first step only
     */
    REQUEST("Request"),

    RESEARCH_BRIEF("ResearchBrief"),
    CONTENT_BRIEF("ContentBrief"),
    DRAFT_CONTENT("DraftContent"),
    VOICE_CHECK_RESULT("VoiceCheckResult"),
    PRODUCTION_OUTPUT("ProductionOutput");

    private final String code;

    ArtifactKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
