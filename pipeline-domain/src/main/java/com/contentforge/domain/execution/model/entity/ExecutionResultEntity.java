package com.contentforge.domain.execution.model.entity;

import com.contentforge.domain.execution.model.valobj.StepLedgerEntry;
import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.RunStatusEnum;
import com.contentforge.types.enums.WorkflowShapeEnum;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one pipeline run, built incrementally by the executor.
 * <p>
 * The ledger and the error list are append-only; every output key is written once. Callers only
 * ever see read-only views.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Getter
public class ExecutionResultEntity {

    /**
     * Workflow shape chosen for the request
     */
    private final WorkflowShapeEnum workflowShape;

    /**
     * Run status
     */
    private RunStatusEnum status;

    private final List<StepLedgerEntry> stepLedger = new ArrayList<>();

    private final Map<String, Object> outputs = new LinkedHashMap<>();

    private final List<String> errors = new ArrayList<>();

    /**
     * Message of the error that ended the run, null unless FAILED or CANCELLED
     */
    private String failureMessage;

    private final LocalDateTime startTime;

    private LocalDateTime endTime;

    private boolean success;

    private ExecutionResultEntity(WorkflowShapeEnum workflowShape) {
        this.workflowShape = workflowShape;
        this.status = RunStatusEnum.PLANNED;
        this.startTime = LocalDateTime.now();
    }

    public static ExecutionResultEntity planned(WorkflowShapeEnum workflowShape) {
        return new ExecutionResultEntity(workflowShape);
    }

    /**
     * Planned -> Running, on the first step invocation.
     */
    public void start() {
        if (this.status != RunStatusEnum.PLANNED) {
            throw new IllegalStateException("Run must be PLANNED to start, current status: " + status);
        }
        this.status = RunStatusEnum.RUNNING;
    }

    public void record(StepLedgerEntry entry) {
        requireRunning("record a step");
        stepLedger.add(entry);
        if (!entry.success() && entry.error() != null) {
            errors.add(entry.step() + Constants.ERROR_SEPARATOR + entry.error());
        }
    }

    public void putOutput(String key, Object value) {
        requireRunning("store an output");
        if (outputs.containsKey(key)) {
            throw new IllegalStateException("Output key already written: " + key);
        }
        outputs.put(key, value);
    }

    public void complete() {
        requireRunning("complete");
        this.status = RunStatusEnum.COMPLETED;
        this.success = true;
        this.endTime = LocalDateTime.now();
    }

    public void fail(String message) {
        finishUnsuccessfully(RunStatusEnum.FAILED, message);
    }

    public void cancel(String message) {
        finishUnsuccessfully(RunStatusEnum.CANCELLED, message);
    }

    private void finishUnsuccessfully(RunStatusEnum terminalStatus, String message) {
        if (this.status.isTerminal()) {
            throw new IllegalStateException("Run already finished with status: " + status);
        }
        this.status = terminalStatus;
        this.success = false;
        this.failureMessage = message;
        if (message != null && !errors.contains(message)) {
            errors.add(message);
        }
        this.endTime = LocalDateTime.now();
    }

    private void requireRunning(String action) {
        if (this.status != RunStatusEnum.RUNNING) {
            throw new IllegalStateException("Run must be RUNNING to " + action + ", current status: " + status);
        }
    }

    public List<StepLedgerEntry> getStepLedger() {
        return Collections.unmodifiableList(stepLedger);
    }

    public Map<String, Object> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public <T> T getOutput(String key, Class<T> type) {
        Object value = outputs.get(key);
        return type.isInstance(value) ? type.cast(value) : null;
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> getOutputList(String key, Class<T> elementType) {
        Object value = outputs.get(key);
        if (!(value instanceof List<?> list)) {
            return Collections.emptyList();
        }
        for (Object item : list) {
            if (!elementType.isInstance(item)) {
                return Collections.emptyList();
            }
        }
        return (List<T>) list;
    }
}
