package com.contentforge.domain.planning.model.valobj;

import com.contentforge.types.enums.WorkflowShapeEnum;

import java.util.List;
import java.util.Objects;

/**
 * A workflow shape expanded into ordered steps.
 */
public record ExecutionPlan(WorkflowShapeEnum shape,
                            List<PlanStep> steps,
                            PlanRequirements requirements) {

    public ExecutionPlan {
        Objects.requireNonNull(shape, "shape");
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }
}
