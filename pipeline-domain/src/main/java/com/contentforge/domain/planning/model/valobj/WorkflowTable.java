package com.contentforge.domain.planning.model.valobj;

import com.contentforge.types.enums.WorkflowShapeEnum;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Workflow shape to ordered step names. Names stay strings here so that configured overrides are
 * checked in one place, when a plan is built.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public final class WorkflowTable {

    private static final List<String> FULL_SEQUENCE = List.of("research", "brief", "draft", "voice-check", "format");

    private final Map<WorkflowShapeEnum, List<String>> sequences;

    private WorkflowTable(Map<WorkflowShapeEnum, List<String>> sequences) {
        this.sequences = Collections.unmodifiableMap(sequences);
    }

    public static WorkflowTable defaults() {
        Map<WorkflowShapeEnum, List<String>> sequences = new EnumMap<>(WorkflowShapeEnum.class);
        sequences.put(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, FULL_SEQUENCE);
        sequences.put(WorkflowShapeEnum.MULTI_TARGET_CAMPAIGN, FULL_SEQUENCE);
        sequences.put(WorkflowShapeEnum.PRESENTATION, List.of("research", "brief", "draft", "format"));
        sequences.put(WorkflowShapeEnum.SOCIAL_ONLY, List.of("research", "brief", "draft", "voice-check"));
        sequences.put(WorkflowShapeEnum.EMAIL_SEQUENCE, FULL_SEQUENCE);
        return new WorkflowTable(sequences);
    }

    /**
     * Replace the sequences of the given shapes; shapes absent from {@code overrides} keep their
     * default sequence.
     */
    public WorkflowTable withOverrides(Map<WorkflowShapeEnum, List<String>> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<WorkflowShapeEnum, List<String>> merged = new EnumMap<>(WorkflowShapeEnum.class);
        merged.putAll(sequences);
        for (Map.Entry<WorkflowShapeEnum, List<String>> entry : overrides.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            merged.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        return new WorkflowTable(merged);
    }

    public List<String> sequenceOf(WorkflowShapeEnum shape) {
        List<String> sequence = sequences.get(shape);
        return sequence == null ? List.of() : sequence;
    }
}
