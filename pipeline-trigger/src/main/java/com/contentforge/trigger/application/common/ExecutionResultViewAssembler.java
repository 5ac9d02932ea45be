package com.contentforge.trigger.application.common;

import com.contentforge.api.dto.ExecutionResultDTO;
import com.contentforge.api.dto.PipelineJobDTO;
import com.contentforge.api.dto.PlanStepDTO;
import com.contentforge.api.dto.StepLedgerEntryDTO;
import com.contentforge.domain.execution.model.entity.ExecutionResultEntity;
import com.contentforge.domain.execution.model.valobj.StepLedgerEntry;
import com.contentforge.domain.job.model.entity.PipelineJobEntity;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.types.enums.ContentTypeEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * View assembler: plan, ledger, result and job entities to API DTOs. Artifacts are flattened to
 * plain maps through Jackson so callers never hold a reference into a run's outputs.
 */
@Component
public class ExecutionResultViewAssembler {

    private final ObjectMapper objectMapper;

    public ExecutionResultViewAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<PlanStepDTO> toPlanStepDTOs(ExecutionPlan plan) {
        if (plan == null) {
            return Collections.emptyList();
        }
        List<PlanStepDTO> steps = new ArrayList<>(plan.size());
        for (PlanStep step : plan.steps()) {
            steps.add(toPlanStepDTO(step));
        }
        return steps;
    }

    public PlanStepDTO toPlanStepDTO(PlanStep step) {
        if (step == null) {
            return null;
        }
        PlanStepDTO dto = new PlanStepDTO();
        dto.setStepName(step.stepName());
        dto.setProducerRole(step.producerRole().getCode());
        dto.setInputKind(step.inputKind().getCode());
        dto.setOutputKind(step.outputKind().getCode());
        dto.setGateName(step.gate() == null ? null : step.gate().getCode());
        dto.setParallel(step.parallel());
        dto.setTracks(step.isFanOut() ? step.tracks().stream().map(ContentTypeEnum::getCode).toList() : null);
        return dto;
    }

    public StepLedgerEntryDTO toStepLedgerEntryDTO(StepLedgerEntry entry) {
        if (entry == null) {
            return null;
        }
        StepLedgerEntryDTO dto = new StepLedgerEntryDTO();
        dto.setStep(entry.step());
        dto.setTrack(entry.track() == null ? null : entry.track().getCode());
        dto.setOutputKind(entry.outputKind() == null ? null : entry.outputKind().getCode());
        dto.setSuccess(entry.success());
        dto.setError(entry.error());
        dto.setTimestamp(entry.timestamp());
        return dto;
    }

    public ExecutionResultDTO toExecutionResultDTO(ExecutionResultEntity result) {
        if (result == null) {
            return null;
        }
        ExecutionResultDTO dto = new ExecutionResultDTO();
        dto.setWorkflowShape(result.getWorkflowShape() == null ? null : result.getWorkflowShape().getCode());
        dto.setStatus(result.getStatus() == null ? null : result.getStatus().getCode());
        dto.setStepLedger(result.getStepLedger().stream().map(this::toStepLedgerEntryDTO).toList());
        Map<String, Object> outputs = new LinkedHashMap<>();
        result.getOutputs().forEach((key, value) -> outputs.put(key, toPlainValue(value)));
        dto.setOutputs(outputs);
        dto.setErrors(new ArrayList<>(result.getErrors()));
        dto.setStartTime(result.getStartTime());
        dto.setEndTime(result.getEndTime());
        dto.setSuccess(result.isSuccess());
        return dto;
    }

    public PipelineJobDTO toPipelineJobDTO(PipelineJobEntity job) {
        if (job == null) {
            return null;
        }
        PipelineJobDTO dto = new PipelineJobDTO();
        dto.setRunId(job.getRunId());
        dto.setRequestText(job.getRequestText());
        dto.setContentTypes(job.getContentTypes() == null
                ? null
                : job.getContentTypes().stream().map(ContentTypeEnum::getCode).toList());
        dto.setWorkflowShape(job.getWorkflowShape() == null ? null : job.getWorkflowShape().getCode());
        dto.setStatus(job.getStatus() == null ? null : job.getStatus().getCode());
        dto.setProgress(job.getProgress());
        dto.setCurrentStep(job.getCurrentStep());
        dto.setCompletedSteps(job.getCompletedSteps());
        dto.setTotalSteps(job.getTotalSteps());
        dto.setErrorMessage(job.getErrorMessage());
        dto.setResult(job.isTerminal() ? toExecutionResultDTO(job.getResult()) : null);
        dto.setCreatedAt(job.getCreatedAt());
        dto.setUpdatedAt(job.getUpdatedAt());
        return dto;
    }

    private Object toPlainValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof List<?> list) {
            List<Object> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(toPlainValue(item));
            }
            return items;
        }
        return objectMapper.convertValue(value, Object.class);
    }
}
