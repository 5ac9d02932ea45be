package com.contentforge.domain.planning.service;

import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanRequirements;
import com.contentforge.types.enums.WorkflowShapeEnum;

/**
 * Plan builder: classifies a request into a workflow shape and expands that shape into steps.
 * Every method is a pure function of its arguments.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public interface PlannerService {

    WorkflowShapeEnum classify(ContentRequest request);

    PlanRequirements parseRequirements(ContentRequest request);

    /**
     * Expand a shape into an ordered plan.
     *
     * @throws com.contentforge.types.exception.AppException with code
     *         {@code PLAN_CONFIG_ERROR} when the workflow table is malformed
     */
    ExecutionPlan buildPlan(WorkflowShapeEnum shape, PlanRequirements requirements);

    default ExecutionPlan plan(ContentRequest request) {
        return buildPlan(classify(request), parseRequirements(request));
    }
}
