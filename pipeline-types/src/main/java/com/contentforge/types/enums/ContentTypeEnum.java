package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Content kinds a request can ask for.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum ContentTypeEnum {

    ARTICLE("article"),
    BLOG_POST("blog_post"),
    SOCIAL_POST("social_post"),
    PRESENTATION("presentation"),
    EMAIL("email"),
    NEWSLETTER("newsletter"),
    VIDEO_SCRIPT("video_script"),
    WHITEPAPER("whitepaper"),
    CASE_STUDY("case_study");

    private final String code;

    ContentTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ContentTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (ContentTypeEnum type : ContentTypeEnum.values()) {
            if (type.code.equalsIgnoreCase(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + code);
    }
}
