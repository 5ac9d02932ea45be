package com.contentforge.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output formats a format producer may be asked for.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public enum OutputFormatEnum {

    MARKDOWN("markdown", "md"),
    HTML("html", "html"),
    DOCX("docx", "docx"),
    PDF("pdf", "pdf"),
    PPTX("pptx", "pptx");

    private final String code;
    private final String extension;

    OutputFormatEnum(String code, String extension) {
        this.code = code;
        this.extension = extension;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getExtension() {
        return extension;
    }

    public static OutputFormatEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim();
        for (OutputFormatEnum format : OutputFormatEnum.values()) {
            if (format.code.equalsIgnoreCase(normalized) || format.extension.equalsIgnoreCase(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + code);
    }
}
