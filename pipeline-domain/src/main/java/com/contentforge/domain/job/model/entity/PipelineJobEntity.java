package com.contentforge.domain.job.model.entity;

import com.contentforge.domain.execution.model.entity.ExecutionResultEntity;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.JobStatusEnum;
import com.contentforge.types.enums.WorkflowShapeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A tracked pipeline run.
 * <p>
 * Only the task driving the run writes the entity; pollers read copies handed out by the job store.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Data
public class PipelineJobEntity {

    /**
     * Run id assigned on submit
     */
    private String runId;

    /**
     * Request topic text
     */
    private String requestText;

    /**
     * Requested content kinds, declared order
     */
    private List<ContentTypeEnum> contentTypes;

    private WorkflowShapeEnum workflowShape;

    private JobStatusEnum status;

    /**
     * Number of plan steps
     */
    private int totalSteps;

    /**
     * Number of plan steps with at least one ledger entry
     */
    private int completedSteps;

    /**
     * Step that recorded the latest ledger entry
     */
    private String currentStep;

    /**
     * 0-100; only reaches 100 once the job is terminal
     */
    private int progress;

    /**
     * Execution result, null until the run returns
     */
    private ExecutionResultEntity result;

    /**
     * Error that ended the job, null unless FAILED or CANCELLED
     */
    private String errorMessage;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public static PipelineJobEntity pending(String runId, String requestText, List<ContentTypeEnum> contentTypes,
                                            WorkflowShapeEnum workflowShape, int totalSteps) {
        PipelineJobEntity job = new PipelineJobEntity();
        job.setRunId(runId);
        job.setRequestText(requestText);
        job.setContentTypes(contentTypes == null ? new ArrayList<>() : new ArrayList<>(contentTypes));
        job.setWorkflowShape(workflowShape);
        job.setStatus(JobStatusEnum.PENDING);
        job.setTotalSteps(Math.max(totalSteps, 0));
        LocalDateTime now = LocalDateTime.now();
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        return job;
    }

    /**
     * Pending -> Running
     */
    public void start() {
        if (this.status != JobStatusEnum.PENDING) {
            throw new IllegalStateException("Job must be PENDING to start, current status: " + status);
        }
        this.status = JobStatusEnum.RUNNING;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Progress after a ledger entry of the given plan step (1-based).
     */
    public void recordProgress(String stepName, int stepNumber) {
        if (this.status != JobStatusEnum.RUNNING) {
            throw new IllegalStateException("Only running jobs report progress, current status: " + status);
        }
        this.currentStep = stepName;
        this.completedSteps = Math.max(this.completedSteps, Math.min(stepNumber, totalSteps));
        this.progress = totalSteps <= 0 ? 0 : Math.min(99, completedSteps * 100 / totalSteps);
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Running -> status of the returned run.
     */
    public void finish(ExecutionResultEntity executionResult) {
        if (this.status != JobStatusEnum.RUNNING) {
            throw new IllegalStateException("Job must be RUNNING to finish, current status: " + status);
        }
        this.result = executionResult;
        this.status = JobStatusEnum.fromRunStatus(executionResult.getStatus());
        this.errorMessage = executionResult.getFailureMessage();
        this.progress = 100;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Cancelled before the run started.
     */
    public void cancel(String reason) {
        if (this.status.isTerminal()) {
            throw new IllegalStateException("Cannot cancel a finished job, current status: " + status);
        }
        this.status = JobStatusEnum.CANCELLED;
        this.errorMessage = reason;
        this.progress = 100;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * The run could not be started or raised outside the executor's own error handling.
     */
    public void fail(String error) {
        if (this.status.isTerminal()) {
            throw new IllegalStateException("Cannot fail a finished job, current status: " + status);
        }
        this.status = JobStatusEnum.FAILED;
        this.errorMessage = error;
        this.progress = 100;
        this.updatedAt = LocalDateTime.now();
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    /**
     * Snapshot for readers. The execution result is shared: it is only handed out once terminal.
     */
    public PipelineJobEntity copy() {
        PipelineJobEntity copy = new PipelineJobEntity();
        copy.setRunId(runId);
        copy.setRequestText(requestText);
        copy.setContentTypes(contentTypes == null ? null : new ArrayList<>(contentTypes));
        copy.setWorkflowShape(workflowShape);
        copy.setStatus(status);
        copy.setTotalSteps(totalSteps);
        copy.setCompletedSteps(completedSteps);
        copy.setCurrentStep(currentStep);
        copy.setProgress(progress);
        copy.setResult(result);
        copy.setErrorMessage(errorMessage);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
