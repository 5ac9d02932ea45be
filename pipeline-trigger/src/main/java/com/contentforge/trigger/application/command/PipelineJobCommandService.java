package com.contentforge.trigger.application.command;

import com.contentforge.domain.execution.adapter.gateway.IExecutionProgressListener;
import com.contentforge.domain.execution.model.entity.ExecutionResultEntity;
import com.contentforge.domain.execution.model.valobj.CancellationSignal;
import com.contentforge.domain.execution.model.valobj.StepLedgerEntry;
import com.contentforge.domain.execution.service.PipelineExecutor;
import com.contentforge.domain.job.adapter.repository.IPipelineJobRepository;
import com.contentforge.domain.job.model.entity.PipelineJobEntity;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.domain.planning.service.PlannerService;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Job write use cases: submit a request as a background run, cancel a run.
 * <p>
 * Each submitted run is driven by one worker task, which is the only writer of its job entry.
 * Cancellation only raises the run's signal; the worker records the outcome.
 * </p>
 */
@Slf4j
@Service
public class PipelineJobCommandService {

    private final PipelineExecutor pipelineExecutor;
    private final PlannerService plannerService;
    private final IPipelineJobRepository pipelineJobRepository;
    private final Executor pipelineRunWorker;
    private final Map<String, CancellationSignal> activeSignals = new ConcurrentHashMap<>();
    private final Counter submitCounter;
    private final Counter rejectCounter;

    public PipelineJobCommandService(PipelineExecutor pipelineExecutor,
                                     PlannerService plannerService,
                                     IPipelineJobRepository pipelineJobRepository,
                                     @Qualifier("pipelineRunWorker") Executor pipelineRunWorker) {
        this.pipelineExecutor = pipelineExecutor;
        this.plannerService = plannerService;
        this.pipelineJobRepository = pipelineJobRepository;
        this.pipelineRunWorker = pipelineRunWorker;
        this.submitCounter = Counter.builder("content.pipeline.job.submit.total").register(Metrics.globalRegistry);
        this.rejectCounter = Counter.builder("content.pipeline.job.reject.total").register(Metrics.globalRegistry);
    }

    /**
     * Track and start a run.
     *
     * @return run id to poll with
     * @throws AppException {@code PLAN_CONFIG_ERROR} if the request cannot be planned, {@code UN_ERROR}
     *                      if no worker could take the run
     */
    public String submit(ContentRequest request) {
        if (request == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Content request is required");
        }
        ExecutionPlan plan = plannerService.plan(request);
        String runId = UUID.randomUUID().toString();
        PipelineJobEntity job = PipelineJobEntity.pending(runId, request.requestText(), request.contentTypes(),
                plan.shape(), plan.size());
        pipelineJobRepository.save(job);
        CancellationSignal signal = CancellationSignal.none();
        activeSignals.put(runId, signal);
        try {
            pipelineRunWorker.execute(() -> runJob(job, request, plan, signal));
        } catch (RejectedExecutionException ex) {
            activeSignals.remove(runId);
            job.fail("Run rejected: " + StringUtils.defaultIfBlank(ex.getMessage(), "worker pool saturated"));
            pipelineJobRepository.update(job);
            rejectCounter.increment();
            log.warn("Pipeline job rejected. runId={}, error={}", runId, ex.getMessage());
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Pipeline workers are saturated, retry later", ex);
        }
        submitCounter.increment();
        log.info("Pipeline job submitted. runId={}, shape={}, contentTypes={}",
                runId, plan.shape().getCode(), request.contentTypes());
        return runId;
    }

    /**
     * Ask a run to stop before its next step or track.
     *
     * @return true if the run was still active and has been signalled
     * @throws AppException {@code JOB_NOT_FOUND} if the run id is unknown or expired
     */
    public boolean cancel(String runId) {
        PipelineJobEntity job = pipelineJobRepository.findByRunId(runId);
        if (job == null) {
            throw new AppException(ResponseCode.JOB_NOT_FOUND.getCode(), "Job not found: " + runId);
        }
        if (job.isTerminal()) {
            log.info("Cancel ignored, job already finished. runId={}, status={}", runId, job.getStatus());
            return false;
        }
        CancellationSignal signal = activeSignals.get(runId);
        if (signal == null) {
            return false;
        }
        signal.cancel();
        log.info("Pipeline job cancellation requested. runId={}", runId);
        return true;
    }

    public int activeRunCount() {
        return activeSignals.size();
    }

    void runJob(PipelineJobEntity job, ContentRequest request, ExecutionPlan plan, CancellationSignal signal) {
        String runId = job.getRunId();
        try {
            if (signal.isCancelled()) {
                job.cancel(signal.reason());
                pipelineJobRepository.update(job);
                log.info("Pipeline job cancelled before start. runId={}", runId);
                return;
            }
            job.start();
            pipelineJobRepository.update(job);
            ExecutionResultEntity result = pipelineExecutor.execute(request, signal, new IExecutionProgressListener() {
                @Override
                public void onStepRecorded(PlanStep step, StepLedgerEntry entry) {
                    job.recordProgress(step.stepName(), plan.steps().indexOf(step) + 1);
                    pipelineJobRepository.update(job);
                }
            });
            job.finish(result);
            pipelineJobRepository.update(job);
            log.info("Pipeline job finished. runId={}, status={}, success={}, errors={}",
                    runId, job.getStatus(), result.isSuccess(), result.getErrors().size());
        } catch (RuntimeException ex) {
            log.error("Pipeline job failed. runId={}, error={}", runId, ex.getMessage(), ex);
            if (!job.isTerminal()) {
                job.fail(StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName()));
                pipelineJobRepository.update(job);
            }
        } finally {
            activeSignals.remove(runId);
        }
    }
}
