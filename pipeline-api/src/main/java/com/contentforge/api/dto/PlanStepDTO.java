package com.contentforge.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Plan step DTO, as displayed by status tooling.
 */
@Data
public class PlanStepDTO {

    private String stepName;
    private String producerRole;
    private String inputKind;
    private String outputKind;
    private String gateName;
    private boolean parallel;
    private List<String> tracks;
}
