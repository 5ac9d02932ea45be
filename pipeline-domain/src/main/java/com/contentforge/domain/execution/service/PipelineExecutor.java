package com.contentforge.domain.execution.service;

import com.contentforge.domain.content.model.valobj.ContentBrief;
import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.ProductionOutput;
import com.contentforge.domain.content.model.valobj.ResearchBrief;
import com.contentforge.domain.content.model.valobj.Validatable;
import com.contentforge.domain.content.model.valobj.VoiceCheckResult;
import com.contentforge.domain.execution.adapter.gateway.IBriefProducer;
import com.contentforge.domain.execution.adapter.gateway.IDraftProducer;
import com.contentforge.domain.execution.adapter.gateway.IExecutionProgressListener;
import com.contentforge.domain.execution.adapter.gateway.IFormatProducer;
import com.contentforge.domain.execution.adapter.gateway.IResearchProducer;
import com.contentforge.domain.execution.adapter.gateway.IStageProducer;
import com.contentforge.domain.execution.adapter.gateway.IVoiceCheckProducer;
import com.contentforge.domain.execution.model.entity.ExecutionResultEntity;
import com.contentforge.domain.execution.model.valobj.CancellationSignal;
import com.contentforge.domain.execution.model.valobj.PipelineExecutionPolicy;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.domain.execution.model.valobj.StepLedgerEntry;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.domain.planning.service.PlannerService;
import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.OutputFormatEnum;
import com.contentforge.types.enums.ProducerRoleEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.RunStatusEnum;
import com.contentforge.types.enums.ToneTypeEnum;
import com.contentforge.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Pipeline executor: walks a plan in order, invokes one producer per step (or one per track on
 * fan-out steps), applies quality gates and records every invocation in the run's step ledger.
 * <p>
 * Lenient policy records gate failures and continues; strict policy ends the run on the first
 * gate failure. A producer exception always ends the run as FAILED. Fan-out tracks of a step
 * flagged parallel may run concurrently on the track executor, but ledger entries, gates and
 * outputs are always applied on the calling thread, in declared track order, after every track
 * has finished. Every concurrent track that ran is recorded before the first run-ending error
 * is raised.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
public class PipelineExecutor {

    public static final String TONE_KEY = "tone";

    private static final String RUN_COUNTER = "content.pipeline.run.total";
    private static final String GATE_FAILURE_COUNTER = "content.pipeline.gate.failure.total";
    private static final String PRODUCER_ERROR_COUNTER = "content.pipeline.producer.error.total";

    private final PlannerService plannerService;
    private final StageProducerRegistry producerRegistry;
    private final QualityGateDomainService qualityGateDomainService;
    private final FormatNegotiationDomainService formatNegotiationDomainService;
    private final PipelineExecutionPolicy policy;
    private final Executor trackExecutor;

    /**
     * @param trackExecutor executor for concurrent fan-out tracks; null runs every track on the
     *                      calling thread, as does a {@link ThreadPoolExecutor} whose rejection
     *                      handler discards tasks
     */
    public PipelineExecutor(PlannerService plannerService,
                            StageProducerRegistry producerRegistry,
                            QualityGateDomainService qualityGateDomainService,
                            FormatNegotiationDomainService formatNegotiationDomainService,
                            PipelineExecutionPolicy policy,
                            Executor trackExecutor) {
        this.plannerService = Objects.requireNonNull(plannerService, "plannerService");
        this.producerRegistry = Objects.requireNonNull(producerRegistry, "producerRegistry");
        this.qualityGateDomainService = Objects.requireNonNull(qualityGateDomainService, "qualityGateDomainService");
        this.formatNegotiationDomainService = Objects.requireNonNull(formatNegotiationDomainService,
                "formatNegotiationDomainService");
        this.policy = policy == null ? PipelineExecutionPolicy.lenient() : policy;
        this.trackExecutor = discardsTasks(trackExecutor) ? null : trackExecutor;
    }

    /**
     * A pool that silently drops tasks would leave a dispatched track without an outcome, so such a
     * pool is not used and tracks run on the calling thread instead.
     */
    private static boolean discardsTasks(Executor executor) {
        if (!(executor instanceof ThreadPoolExecutor)) {
            return false;
        }
        RejectedExecutionHandler handler = ((ThreadPoolExecutor) executor).getRejectedExecutionHandler();
        if (handler instanceof ThreadPoolExecutor.DiscardPolicy
                || handler instanceof ThreadPoolExecutor.DiscardOldestPolicy) {
            log.warn("Track executor discards rejected tasks, fan-out tracks will run sequentially. handler={}",
                    handler.getClass().getSimpleName());
            return true;
        }
        return false;
    }

    public PipelineExecutionPolicy getPolicy() {
        return policy;
    }

    public ExecutionResultEntity execute(ContentRequest request) {
        return execute(request, CancellationSignal.none(), IExecutionProgressListener.NOOP);
    }

    /**
     * Run a request end to end.
     *
     * @throws AppException with code {@code PLAN_CONFIG_ERROR} when the plan cannot be built or a
     *                      role it needs has no producer; every other failure is reported through
     *                      the returned result
     */
    public ExecutionResultEntity execute(ContentRequest request,
                                         CancellationSignal signal,
                                         IExecutionProgressListener listener) {
        Objects.requireNonNull(request, "request");
        ExecutionPlan plan = plannerService.plan(request);
        producerRegistry.ensureRegistered(plan);

        RunState state = new RunState(request, plan,
                signal == null ? CancellationSignal.none() : signal,
                listener == null ? IExecutionProgressListener.NOOP : listener);
        log.info("Pipeline run planned. shape={}, steps={}, contentTypes={}, strict={}",
                plan.shape().getCode(), plan.size(), request.contentTypes(), policy.strictQualityGates());
        state.notifyRunStarted();

        ExecutionResultEntity result = state.result;
        try {
            int index = 0;
            for (PlanStep step : plan.steps()) {
                index++;
                checkCancelled(step, state);
                log.info("Pipeline step {}/{} started. step={}, tracks={}",
                        index, plan.size(), step.stepName(), step.isFanOut() ? step.tracks() : "single");
                executeStep(step, state);
            }
            state.markRunning();
            result.complete();
            log.info("Pipeline run completed. shape={}, ledger={}, gateFailures={}",
                    plan.shape().getCode(), result.getStepLedger().size(), result.getErrors().size());
        } catch (AppException ex) {
            if (ResponseCode.RUN_CANCELLED.getCode().equals(ex.getCode())) {
                result.cancel(ex.getMessage());
                log.warn("Pipeline run cancelled. shape={}, reason={}", plan.shape().getCode(), ex.getMessage());
            } else {
                result.fail(ex.getMessage());
                log.warn("Pipeline run failed. shape={}, code={}, error={}",
                        plan.shape().getCode(), ex.getCode(), ex.getMessage());
            }
        } catch (RuntimeException ex) {
            String message = StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
            result.fail(message);
            log.error("Pipeline run failed unexpectedly. shape={}, error={}", plan.shape().getCode(), message, ex);
        }
        countRun(result.getStatus());
        return result;
    }

    private void executeStep(PlanStep step, RunState state) {
        switch (step.stepType()) {
            case RESEARCH -> runResearch(step, state);
            case BRIEF -> runBrief(step, state);
            case DRAFT -> runDraft(step, state);
            case VOICE_CHECK -> runVoiceCheck(step, state);
            case FORMAT -> runFormat(step, state);
            default -> throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                    "Unsupported step: " + step.stepName());
        }
    }

    private void runResearch(PlanStep step, RunState state) {
        IResearchProducer producer = producerRegistry.require(ProducerRoleEnum.RESEARCH, IResearchProducer.class);
        List<Lane<ContentRequest>> lanes = List.of(new Lane<>(null,
                state.request, context(step, state, state.request.primaryContentType())));
        List<ResearchBrief> outputs = runLanes(step, producer, lanes, state);
        state.research = outputs.get(0);
        storeOutputs(step, outputs, state);
    }

    private void runBrief(PlanStep step, RunState state) {
        IBriefProducer producer = producerRegistry.require(ProducerRoleEnum.BRIEF, IBriefProducer.class);
        ResearchBrief research = requireInput(state.research, step);
        List<Lane<ResearchBrief>> lanes = new ArrayList<>();
        for (ContentTypeEnum track : tracksOf(step, state)) {
            lanes.add(new Lane<>(ledgerTrack(step, track), research, context(step, state, track)));
        }
        state.briefs = runLanes(step, producer, lanes, state);
        storeOutputs(step, state.briefs, state);
    }

    private void runDraft(PlanStep step, RunState state) {
        IDraftProducer producer = producerRegistry.require(ProducerRoleEnum.DRAFT, IDraftProducer.class);
        List<ContentTypeEnum> tracks = tracksOf(step, state);
        List<ContentBrief> briefs = requireAligned(state.briefs, tracks, step);
        List<Lane<ContentBrief>> lanes = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            ContentTypeEnum track = tracks.get(i);
            lanes.add(new Lane<>(ledgerTrack(step, track), briefs.get(i), context(step, state, track)));
        }
        state.drafts = runLanes(step, producer, lanes, state);
        storeOutputs(step, state.drafts, state);
    }

    private void runVoiceCheck(PlanStep step, RunState state) {
        IVoiceCheckProducer producer = producerRegistry.require(ProducerRoleEnum.VOICE_CHECK,
                IVoiceCheckProducer.class);
        List<ContentTypeEnum> tracks = tracksOf(step, state);
        List<DraftContent> drafts = requireAligned(state.drafts, tracks, step);
        List<Lane<DraftContent>> lanes = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            ContentTypeEnum track = tracks.get(i);
            // campaign tracks are all checked against the first brief's tone
            ContentBrief toneSource = step.isFanOut() ? state.briefs.get(0) : state.briefs.get(i);
            StageContext context = context(step, state, track).withTargetTone(targetTone(toneSource, state));
            lanes.add(new Lane<>(ledgerTrack(step, track), drafts.get(i), context));
        }
        List<VoiceCheckResult> outputs = runLanes(step, producer, lanes, state);
        storeOutputs(step, outputs, state);
    }

    private void runFormat(PlanStep step, RunState state) {
        IFormatProducer producer = producerRegistry.require(ProducerRoleEnum.FORMAT, IFormatProducer.class);
        List<ContentTypeEnum> tracks = tracksOf(step, state);
        List<DraftContent> drafts = requireAligned(state.drafts, tracks, step);
        List<OutputFormatEnum> requested = formatNegotiationDomainService.resolveRequestedFormats(
                state.request.context(), policy.defaultOutputFormat());
        List<OutputFormatEnum> formats = formatNegotiationDomainService.negotiateAll(requested, producer);
        if (formats.isEmpty()) {
            throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                    "Format producer offers no usable output format");
        }
        List<Lane<DraftContent>> lanes = new ArrayList<>();
        for (int i = 0; i < tracks.size(); i++) {
            ContentTypeEnum track = tracks.get(i);
            for (OutputFormatEnum format : formats) {
                StageContext context = context(step, state, track).withOutputFormat(format);
                lanes.add(new Lane<>(ledgerTrack(step, track), drafts.get(i), context));
            }
        }
        List<ProductionOutput> outputs = runLanes(step, producer, lanes, state);
        storeOutputs(step, outputs, state);
    }

    private <I, O extends Validatable> List<O> runLanes(PlanStep step,
                                                         IStageProducer<I, O> producer,
                                                         List<Lane<I>> lanes,
                                                         RunState state) {
        if (step.parallel() && policy.parallelFanOut() && trackExecutor != null && lanes.size() > 1) {
            return runLanesConcurrently(step, producer, lanes, state);
        }
        List<O> outputs = new ArrayList<>(lanes.size());
        for (Lane<I> lane : lanes) {
            checkCancelled(step, state);
            state.markRunning();
            O artifact;
            try {
                artifact = producer.invoke(lane.input(), lane.context());
            } catch (RuntimeException ex) {
                throw producerFailure(step, lane, ex, state);
            }
            outputs.add(accept(step, lane, artifact, state));
        }
        return outputs;
    }

    private <I, O extends Validatable> List<O> runLanesConcurrently(PlanStep step,
                                                                     IStageProducer<I, O> producer,
                                                                     List<Lane<I>> lanes,
                                                                     RunState state) {
        checkCancelled(step, state);
        state.markRunning();
        List<CompletableFuture<O>> futures = new ArrayList<>(lanes.size());
        for (Lane<I> lane : lanes) {
            if (state.signal.isCancelled()) {
                futures.add(CompletableFuture.failedFuture(new CancellationException(state.signal.reason())));
                continue;
            }
            try {
                futures.add(CompletableFuture.supplyAsync(
                        () -> producer.invoke(lane.input(), lane.context()), trackExecutor));
            } catch (RejectedExecutionException ex) {
                log.warn("Track executor saturated, running track on caller. step={}, track={}",
                        step.stepName(), lane.track());
                futures.add(invokeOnCaller(producer, lane));
            }
        }
        // fan-in only after every dispatched track has finished
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).handle((ignored, error) -> null).join();

        // every track has run, so each one gets its ledger entry before the first error ends the run
        List<O> outputs = new ArrayList<>(lanes.size());
        AppException firstError = null;
        for (int i = 0; i < lanes.size(); i++) {
            Lane<I> lane = lanes.get(i);
            O artifact;
            try {
                artifact = futures.get(i).join();
            } catch (CompletionException | CancellationException ex) {
                Throwable cause = unwrap(ex);
                AppException error = cause instanceof CancellationException && state.signal.isCancelled()
                        ? cancelled(step, state)
                        : producerFailure(step, lane, cause, state);
                firstError = firstError == null ? error : firstError;
                continue;
            }
            try {
                outputs.add(accept(step, lane, artifact, state));
            } catch (AppException ex) {
                firstError = firstError == null ? ex : firstError;
            }
        }
        if (firstError != null) {
            throw firstError;
        }
        return outputs;
    }

    private <I, O extends Validatable> CompletableFuture<O> invokeOnCaller(IStageProducer<I, O> producer,
                                                                           Lane<I> lane) {
        try {
            return CompletableFuture.completedFuture(producer.invoke(lane.input(), lane.context()));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    /**
     * Gate one artifact and record its ledger entry.
     */
    private <I, O extends Validatable> O accept(PlanStep step, Lane<I> lane, O artifact, RunState state) {
        if (artifact == null) {
            throw producerFailure(step, lane,
                    new IllegalStateException("Producer " + step.producerRole().getCode() + " returned no artifact"),
                    state);
        }
        QualityGateDomainService.GateDecision decision =
                qualityGateDomainService.evaluate(step, artifact, policy.strictQualityGates());
        if (decision.passed()) {
            state.record(step, StepLedgerEntry.succeeded(step.stepName(), lane.track(), artifact.artifactKind()));
            return artifact;
        }
        state.record(step, StepLedgerEntry.failed(step.stepName(), lane.track(), artifact.artifactKind(),
                decision.message()));
        Counter.builder(GATE_FAILURE_COUNTER)
                .tag("gate", step.gate().getCode())
                .register(Metrics.globalRegistry)
                .increment();
        log.warn("Quality gate failed. step={}, track={}, gate={}, problems={}, strict={}",
                step.stepName(), lane.track(), step.gate().getCode(), decision.problems(), decision.runEnding());
        if (decision.runEnding()) {
            throw new AppException(ResponseCode.QUALITY_GATE_FAILED.getCode(),
                    step.stepName() + Constants.ERROR_SEPARATOR + decision.message());
        }
        return artifact;
    }

    private AppException producerFailure(PlanStep step, Lane<?> lane, Throwable error, RunState state) {
        String message = StringUtils.defaultIfBlank(error.getMessage(), error.getClass().getSimpleName());
        state.record(step, StepLedgerEntry.failed(step.stepName(), lane.track(), null, message));
        Counter.builder(PRODUCER_ERROR_COUNTER)
                .tag("role", step.producerRole().getCode())
                .register(Metrics.globalRegistry)
                .increment();
        log.error("Producer failed. step={}, track={}, role={}, error={}",
                step.stepName(), lane.track(), step.producerRole().getCode(), message, error);
        return new AppException(ResponseCode.PRODUCER_ERROR.getCode(),
                step.stepName() + Constants.ERROR_SEPARATOR + message, error);
    }

    private void checkCancelled(PlanStep step, RunState state) {
        if (state.signal.isCancelled()) {
            throw cancelled(step, state);
        }
    }

    private AppException cancelled(PlanStep step, RunState state) {
        return new AppException(ResponseCode.RUN_CANCELLED.getCode(),
                step.stepName() + Constants.ERROR_SEPARATOR + state.signal.reason());
    }

    private void storeOutputs(PlanStep step, List<?> outputs, RunState state) {
        boolean asList = step.isFanOut() || step.outputKind() == ArtifactKindEnum.PRODUCTION_OUTPUT;
        state.result.putOutput(step.outputKey(), asList ? List.copyOf(outputs) : outputs.get(0));
    }

    private List<ContentTypeEnum> tracksOf(PlanStep step, RunState state) {
        return step.isFanOut() ? step.tracks() : List.of(state.request.primaryContentType());
    }

    private ContentTypeEnum ledgerTrack(PlanStep step, ContentTypeEnum track) {
        return step.isFanOut() ? track : null;
    }

    private StageContext context(PlanStep step, RunState state, ContentTypeEnum track) {
        return StageContext.forStep(step.stepName(), state.plan.requirements(), track, step.isFanOut());
    }

    private ToneTypeEnum targetTone(ContentBrief brief, RunState state) {
        if (brief != null && brief.tone() != null) {
            return brief.tone();
        }
        Object requested = state.request.context().get(TONE_KEY);
        if (requested != null) {
            try {
                ToneTypeEnum tone = ToneTypeEnum.fromText(String.valueOf(requested));
                if (tone != null) {
                    return tone;
                }
            } catch (IllegalArgumentException ex) {
                log.warn("Unknown tone in request context, using professional. tone={}", requested);
            }
        }
        return ToneTypeEnum.PROFESSIONAL;
    }

    private <T> T requireInput(T input, PlanStep step) {
        if (input == null) {
            throw new IllegalStateException("Step " + step.stepName() + " has no "
                    + step.inputKind().name().toLowerCase() + " input");
        }
        return input;
    }

    private <T> List<T> requireAligned(List<T> inputs, List<ContentTypeEnum> tracks, PlanStep step) {
        if (inputs == null || inputs.size() != tracks.size()) {
            throw new IllegalStateException("Step " + step.stepName() + " expects " + tracks.size()
                    + " " + step.inputKind().name().toLowerCase() + " inputs, got "
                    + (inputs == null ? 0 : inputs.size()));
        }
        return inputs;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void countRun(RunStatusEnum status) {
        Counter.builder(RUN_COUNTER)
                .tag("outcome", status.name().toLowerCase())
                .register(Metrics.globalRegistry)
                .increment();
    }

    /**
     * One producer invocation of a step.
     *
     * @param track ledger track, null outside fan-out steps
     */
    private record Lane<I>(ContentTypeEnum track, I input, StageContext context) {
    }

    /**
     * Mutable per-run state. Only ever touched by the thread driving the run.
     */
    private static final class RunState {

        private final ContentRequest request;
        private final ExecutionPlan plan;
        private final CancellationSignal signal;
        private final IExecutionProgressListener listener;
        private final ExecutionResultEntity result;

        private ResearchBrief research;
        private List<ContentBrief> briefs;
        private List<DraftContent> drafts;

        private RunState(ContentRequest request, ExecutionPlan plan, CancellationSignal signal,
                         IExecutionProgressListener listener) {
            this.request = request;
            this.plan = plan;
            this.signal = signal;
            this.listener = listener;
            this.result = ExecutionResultEntity.planned(plan.shape());
        }

        private void markRunning() {
            if (result.getStatus() == RunStatusEnum.PLANNED) {
                result.start();
            }
        }

        private void record(PlanStep step, StepLedgerEntry entry) {
            result.record(entry);
            try {
                listener.onStepRecorded(step, entry);
            } catch (RuntimeException ex) {
                log.warn("Progress listener failed. step={}, error={}", entry.step(), ex.getMessage());
            }
        }

        private void notifyRunStarted() {
            try {
                listener.onRunStarted(plan);
            } catch (RuntimeException ex) {
                log.warn("Progress listener failed on run start. error={}", ex.getMessage());
            }
        }
    }
}
