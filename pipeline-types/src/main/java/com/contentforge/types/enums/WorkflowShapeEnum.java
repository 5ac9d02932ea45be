package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Route a request follows through the pipeline. Chosen once per request.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum WorkflowShapeEnum {

    /**
     * Single article / blog post / long-form production
     */
    SINGLE_TRACK_PRODUCTION("single_track_production", "Single long-form piece production"),

    /**
     * Content for several targets from one shared research pass
     */
    MULTI_TARGET_CAMPAIGN("multi_target_campaign", "Content for multiple targets from single research"),

    /**
     * Slide deck from research
     */
    PRESENTATION("presentation", "Presentation from research or existing content"),

    /**
     * Social media content only, no file production
     */
    SOCIAL_ONLY("social_only", "Social media content only"),

    /**
     * Email campaign or newsletter
     */
    EMAIL_SEQUENCE("email_sequence", "Email campaign or sequence");

    private final String code;
    private final String description;

    WorkflowShapeEnum(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static WorkflowShapeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().replace('-', '_');
        for (WorkflowShapeEnum shape : WorkflowShapeEnum.values()) {
            if (shape.code.equalsIgnoreCase(normalized) || shape.name().equalsIgnoreCase(normalized)) {
                return shape;
            }
        }
        throw new IllegalArgumentException("Unknown workflow shape: " + code);
    }
}
