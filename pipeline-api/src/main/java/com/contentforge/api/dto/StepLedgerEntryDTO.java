package com.contentforge.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Step ledger entry DTO.
 */
@Data
public class StepLedgerEntryDTO {

    private String step;
    private String track;
    private String outputKind;
    private boolean success;
    private String error;
    private LocalDateTime timestamp;
}
