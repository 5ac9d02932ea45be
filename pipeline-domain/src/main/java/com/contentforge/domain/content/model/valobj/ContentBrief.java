package com.contentforge.domain.content.model.valobj;

import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.ToneTypeEnum;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the brief step; guides drafting for one content kind.
 */
public record ContentBrief(ContentTypeEnum contentType,
                           String targetAudience,
                           List<String> keyMessages,
                           ToneTypeEnum tone,
                           List<String> requiredSections,
                           WordCountRange wordCountRange,
                           List<String> seoKeywords,
                           Map<String, Object> brandGuidelines) implements Validatable {

    public ContentBrief {
        keyMessages = keyMessages == null ? List.of() : List.copyOf(keyMessages);
        requiredSections = requiredSections == null ? List.of() : List.copyOf(requiredSections);
        seoKeywords = seoKeywords == null ? List.of() : List.copyOf(seoKeywords);
        brandGuidelines = brandGuidelines == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(brandGuidelines));
    }

    @Override
    public GateResult checkInvariants() {
        List<String> problems = new ArrayList<>();
        if (StringUtils.isBlank(targetAudience)) {
            problems.add("Target audience must be defined");
        }
        if (keyMessages.isEmpty()) {
            problems.add("At least 1 key message required");
        }
        if (requiredSections.isEmpty()) {
            problems.add("Structure requirements must be defined");
        }
        if (wordCountRange == null || !wordCountRange.isWellFormed()) {
            problems.add("Invalid word count range");
        }
        return GateResult.of(problems);
    }

    @Override
    public ArtifactKindEnum artifactKind() {
        return ArtifactKindEnum.CONTENT_BRIEF;
    }
}
