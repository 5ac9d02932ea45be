package com.contentforge.domain.content.model.valobj;

import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the draft step. {@code brief} is the brief that produced the draft, may be null.
 */
public record DraftContent(String content,
                           ContentTypeEnum contentType,
                           int wordCount,
                           Map<String, Object> metadata,
                           ContentBrief brief,
                           String format) implements Validatable {

    public static final String DEFAULT_FORMAT = "markdown";

    public DraftContent {
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        format = format == null || format.isBlank() ? DEFAULT_FORMAT : format;
    }

    @Override
    public GateResult checkInvariants() {
        List<String> problems = new ArrayList<>();
        if (content == null || content.trim().length() < Constants.MIN_DRAFT_LENGTH) {
            problems.add("Content is too short or empty");
        }
        if (wordCount <= 0) {
            problems.add("Invalid word count");
        }
        if (brief != null && brief.wordCountRange() != null && !brief.wordCountRange().contains(wordCount)) {
            problems.add("Word count " + wordCount + " outside target range " + brief.wordCountRange());
        }
        return GateResult.of(problems);
    }

    @Override
    public ArtifactKindEnum artifactKind() {
        return ArtifactKindEnum.DRAFT_CONTENT;
    }
}
