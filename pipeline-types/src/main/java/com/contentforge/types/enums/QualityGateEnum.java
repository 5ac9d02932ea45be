package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named quality gates. Each gate is the invariant check of the artifact kind it guards.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum QualityGateEnum {

    RESEARCH_COMPLETENESS("research_completeness", "Research"),
    BRIEF_ALIGNMENT("brief_alignment", "Brief"),
    DRAFT_COMPLETENESS("draft_completeness", "Draft"),
    BRAND_CONSISTENCY("brand_consistency", "Brand voice"),
    FORMAT_COMPLIANCE("format_compliance", "Format");

    private final String code;
    private final String label;

    QualityGateEnum(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }
}
