package com.contentforge.domain.content.model.valobj;

import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.ArtifactKindEnum;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of the research step, input of the brief step.
 */
public record ResearchBrief(String topic,
                            List<Source> sources,
                            List<String> keyFindings,
                            Map<String, Object> dataPoints,
                            List<String> researchGaps,
                            LocalDateTime timestamp) implements Validatable {

    public ResearchBrief {
        sources = sources == null ? List.of() : List.copyOf(sources);
        keyFindings = keyFindings == null ? List.of() : List.copyOf(keyFindings);
        dataPoints = dataPoints == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dataPoints));
        researchGaps = researchGaps == null ? List.of() : List.copyOf(researchGaps);
        timestamp = timestamp == null ? LocalDateTime.now() : timestamp;
    }

    /**
     * Research completeness: a topic, at least two sources, at least one key finding and at least
     * one source with credibility of 0.7 or more.
     */
    @Override
    public GateResult checkInvariants() {
        List<String> problems = new ArrayList<>();
        if (StringUtils.isBlank(topic)) {
            problems.add("Topic is required");
        }
        if (sources.size() < 2) {
            problems.add("At least 2 sources required");
        }
        if (keyFindings.isEmpty()) {
            problems.add("Key findings cannot be empty");
        }
        long highQuality = sources.stream()
                .filter(source -> source != null && source.credibilityScore() >= Constants.HIGH_CREDIBILITY_THRESHOLD)
                .count();
        if (highQuality < 1) {
            problems.add("At least 1 high-quality source (credibility >= 0.7) required");
        }
        return GateResult.of(problems);
    }

    @Override
    public ArtifactKindEnum artifactKind() {
        return ArtifactKindEnum.RESEARCH_BRIEF;
    }
}
