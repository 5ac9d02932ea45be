package com.contentforge.trigger.application.query;

import com.contentforge.api.dto.PipelineJobDTO;
import com.contentforge.api.dto.PlanStepDTO;
import com.contentforge.domain.job.adapter.repository.IPipelineJobRepository;
import com.contentforge.domain.job.model.entity.PipelineJobEntity;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.service.PlannerService;
import com.contentforge.trigger.application.common.ExecutionResultViewAssembler;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Job read use cases: poll a job, preview the plan a request would run.
 */
@Service
public class PipelineJobQueryService {

    private final IPipelineJobRepository pipelineJobRepository;
    private final PlannerService plannerService;
    private final ExecutionResultViewAssembler executionResultViewAssembler;

    public PipelineJobQueryService(IPipelineJobRepository pipelineJobRepository,
                                   PlannerService plannerService,
                                   ExecutionResultViewAssembler executionResultViewAssembler) {
        this.pipelineJobRepository = pipelineJobRepository;
        this.plannerService = plannerService;
        this.executionResultViewAssembler = executionResultViewAssembler;
    }

    public PipelineJobDTO findJob(String runId) {
        PipelineJobEntity job = pipelineJobRepository.findByRunId(runId);
        if (job == null) {
            throw new AppException(ResponseCode.JOB_NOT_FOUND.getCode(), "Job not found: " + runId);
        }
        return executionResultViewAssembler.toPipelineJobDTO(job);
    }

    public List<PlanStepDTO> previewPlan(ContentRequest request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Content request is required");
        }
        return executionResultViewAssembler.toPlanStepDTOs(plannerService.plan(request));
    }

    public long trackedJobCount() {
        return pipelineJobRepository.size();
    }
}
