package com.contentforge.domain.execution.model.valobj;

import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One ledger line: the outcome of one producer invocation of a step.
 *
 * @param track      content kind of the track, null outside fan-out steps
 * @param outputKind kind of the emitted artifact, null when the producer raised
 * @param error      gate problems, producer error text or cancellation note; null on success
 */
public record StepLedgerEntry(String step,
                              ContentTypeEnum track,
                              ArtifactKindEnum outputKind,
                              boolean success,
                              String error,
                              LocalDateTime timestamp) {

    public StepLedgerEntry {
        Objects.requireNonNull(step, "step");
        timestamp = timestamp == null ? LocalDateTime.now() : timestamp;
    }

    public static StepLedgerEntry succeeded(String step, ContentTypeEnum track, ArtifactKindEnum outputKind) {
        return new StepLedgerEntry(step, track, outputKind, true, null, LocalDateTime.now());
    }

    public static StepLedgerEntry failed(String step, ContentTypeEnum track, ArtifactKindEnum outputKind,
                                         String error) {
        return new StepLedgerEntry(step, track, outputKind, false, error, LocalDateTime.now());
    }
}
