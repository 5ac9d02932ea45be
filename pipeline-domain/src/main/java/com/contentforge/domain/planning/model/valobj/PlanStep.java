package com.contentforge.domain.planning.model.valobj;

import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.ProducerRoleEnum;
import com.contentforge.types.enums.QualityGateEnum;
import com.contentforge.types.enums.StepTypeEnum;

import java.util.List;
import java.util.Objects;

/**
 * One stage of a plan. Pure data: the executor reads it and never mutates it.
 *
 * @param gate       quality gate run on each emitted artifact, null when the step is ungated
 * @param parallel   tracks of this step may be dispatched concurrently
 * @param tracks     one content kind per independent track, null for single-track steps
 * @param outputKey  key the step's artifact (or per-track list) is stored under
 */
public record PlanStep(StepTypeEnum stepType,
                       ProducerRoleEnum producerRole,
                       ArtifactKindEnum inputKind,
                       ArtifactKindEnum outputKind,
                       QualityGateEnum gate,
                       boolean parallel,
                       List<ContentTypeEnum> tracks,
                       String outputKey) {

    public PlanStep {
        Objects.requireNonNull(stepType, "stepType");
        Objects.requireNonNull(producerRole, "producerRole");
        Objects.requireNonNull(inputKind, "inputKind");
        Objects.requireNonNull(outputKind, "outputKind");
        Objects.requireNonNull(outputKey, "outputKey");
        tracks = tracks == null ? null : List.copyOf(tracks);
    }

    public String stepName() {
        return stepType.getCode();
    }

    public boolean isFanOut() {
        return tracks != null && !tracks.isEmpty();
    }

    public boolean hasGate() {
        return gate != null;
    }
}
