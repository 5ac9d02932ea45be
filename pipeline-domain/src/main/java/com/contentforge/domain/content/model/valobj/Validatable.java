package com.contentforge.domain.content.model.valobj;

import com.contentforge.types.enums.ArtifactKindEnum;

/**
 * Capability shared by every pipeline artifact: an invariant check the executor runs as the
 * quality gate of the step that emitted it.
 */
public interface Validatable {

    GateResult checkInvariants();

    ArtifactKindEnum artifactKind();
}
