package com.contentforge.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Pipeline job status DTO returned on poll.
 */
@Data
public class PipelineJobDTO {

    private String runId;
    private String requestText;
    private List<String> contentTypes;
    private String workflowShape;
    private String status;
    private Integer progress;
    private String currentStep;
    private Integer completedSteps;
    private Integer totalSteps;
    private String errorMessage;
    /** Present once the job is terminal */
    private ExecutionResultDTO result;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
