package com.contentforge.domain.planning.service;

import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanRequirements;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.domain.planning.model.valobj.WorkflowTable;
import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.ProducerRoleEnum;
import com.contentforge.types.enums.QualityGateEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.StepTypeEnum;
import com.contentforge.types.enums.WorkflowShapeEnum;
import com.contentforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Table-driven planner: a fixed decision table for classification and a step table per shape.
 */
@Slf4j
@Service
public class WorkflowPlannerService implements PlannerService {

    private final WorkflowTable workflowTable;

    public WorkflowPlannerService(WorkflowTable workflowTable) {
        this.workflowTable = workflowTable == null ? WorkflowTable.defaults() : workflowTable;
    }

    @Override
    public WorkflowShapeEnum classify(ContentRequest request) {
        List<ContentTypeEnum> contentTypes = request.contentTypes();
        if (contentTypes.size() > 1) {
            return WorkflowShapeEnum.MULTI_TARGET_CAMPAIGN;
        }
        return switch (contentTypes.get(0)) {
            case ARTICLE, BLOG_POST, WHITEPAPER, CASE_STUDY -> WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION;
            case PRESENTATION -> WorkflowShapeEnum.PRESENTATION;
            case SOCIAL_POST -> WorkflowShapeEnum.SOCIAL_ONLY;
            case EMAIL, NEWSLETTER -> WorkflowShapeEnum.EMAIL_SEQUENCE;
            default -> WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION;
        };
    }

    @Override
    public PlanRequirements parseRequirements(ContentRequest request) {
        return new PlanRequirements(
                request.requestText().trim(),
                request.contentTypes(),
                request.priority(),
                request.deadline(),
                request.context());
    }

    @Override
    public ExecutionPlan buildPlan(WorkflowShapeEnum shape, PlanRequirements requirements) {
        if (shape == null) {
            throw configError("Workflow shape is required");
        }
        List<String> sequence = workflowTable.sequenceOf(shape);
        if (sequence.isEmpty()) {
            throw configError("No steps configured for workflow: " + shape.getCode());
        }
        List<ContentTypeEnum> tracks = requirements == null ? List.of() : requirements.contentTypes();
        boolean fanOut = shape == WorkflowShapeEnum.MULTI_TARGET_CAMPAIGN;

        Set<StepTypeEnum> seen = EnumSet.noneOf(StepTypeEnum.class);
        Set<ArtifactKindEnum> available = EnumSet.of(ArtifactKindEnum.REQUEST);
        List<PlanStep> steps = new ArrayList<>(sequence.size());
        for (String stepName : sequence) {
            StepTypeEnum stepType = StepTypeEnum.fromCode(stepName);
            if (stepType == null) {
                throw configError("Unknown step: " + stepName + " in workflow " + shape.getCode());
            }
            if (!seen.add(stepType)) {
                throw configError("Duplicate step: " + stepName + " in workflow " + shape.getCode());
            }
            PlanStep step = createStep(stepType, fanOut ? tracks : null);
            if (!available.contains(step.inputKind())) {
                throw configError("Step " + step.stepName() + " needs " + step.inputKind().getCode()
                        + " which no earlier step of workflow " + shape.getCode() + " produces");
            }
            available.add(step.outputKind());
            steps.add(step);
        }
        log.debug("Plan built. shape={}, steps={}, tracks={}", shape.getCode(), steps.size(), tracks.size());
        return new ExecutionPlan(shape, steps, requirements);
    }

    private PlanStep createStep(StepTypeEnum stepType, List<ContentTypeEnum> tracks) {
        boolean fanOut = tracks != null && !tracks.isEmpty();
        return switch (stepType) {
            case RESEARCH -> new PlanStep(stepType, ProducerRoleEnum.RESEARCH,
                    ArtifactKindEnum.REQUEST, ArtifactKindEnum.RESEARCH_BRIEF,
                    QualityGateEnum.RESEARCH_COMPLETENESS, false, null, "research_brief");
            case BRIEF -> new PlanStep(stepType, ProducerRoleEnum.BRIEF,
                    ArtifactKindEnum.RESEARCH_BRIEF, ArtifactKindEnum.CONTENT_BRIEF,
                    QualityGateEnum.BRIEF_ALIGNMENT, false, fanOut ? tracks : null,
                    fanOut ? "content_briefs" : "content_brief");
            case DRAFT -> new PlanStep(stepType, ProducerRoleEnum.DRAFT,
                    ArtifactKindEnum.CONTENT_BRIEF, ArtifactKindEnum.DRAFT_CONTENT,
                    QualityGateEnum.DRAFT_COMPLETENESS, fanOut, fanOut ? tracks : null,
                    fanOut ? "drafts" : "draft_content");
            case VOICE_CHECK -> new PlanStep(stepType, ProducerRoleEnum.VOICE_CHECK,
                    ArtifactKindEnum.DRAFT_CONTENT, ArtifactKindEnum.VOICE_CHECK_RESULT,
                    QualityGateEnum.BRAND_CONSISTENCY, false, fanOut ? tracks : null,
                    fanOut ? "voice_check_results" : "voice_check_result");
            case FORMAT -> new PlanStep(stepType, ProducerRoleEnum.FORMAT,
                    ArtifactKindEnum.DRAFT_CONTENT, ArtifactKindEnum.PRODUCTION_OUTPUT,
                    QualityGateEnum.FORMAT_COMPLIANCE, false, fanOut ? tracks : null, "production_outputs");
        };
    }

    private AppException configError(String message) {
        return new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(), message);
    }
}
