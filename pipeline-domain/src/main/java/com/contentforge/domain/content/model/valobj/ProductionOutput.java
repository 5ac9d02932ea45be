package com.contentforge.domain.content.model.valobj;

import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final deliverable written by the format step.
 */
public record ProductionOutput(String filePath,
                               String fileFormat,
                               ContentTypeEnum contentType,
                               Map<String, Object> metadata,
                               LocalDateTime timestamp) implements Validatable {

    public ProductionOutput {
        metadata = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        timestamp = timestamp == null ? LocalDateTime.now() : timestamp;
    }

    @Override
    public GateResult checkInvariants() {
        List<String> problems = new ArrayList<>();
        if (StringUtils.isBlank(filePath)) {
            problems.add("File path is required");
        }
        if (StringUtils.isBlank(fileFormat)) {
            problems.add("File format is required");
        }
        return GateResult.of(problems);
    }

    @Override
    public ArtifactKindEnum artifactKind() {
        return ArtifactKindEnum.PRODUCTION_OUTPUT;
    }
}
