package com.contentforge.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Execution result DTO. Artifacts in {@code outputs} are plain maps (or lists of maps).
 */
@Data
public class ExecutionResultDTO {

    private String workflowShape;
    private String status;
    private List<StepLedgerEntryDTO> stepLedger;
    private Map<String, Object> outputs;
    private List<String> errors;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private boolean success;
}
