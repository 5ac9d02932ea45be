package com.contentforge.test;

import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.ProductionOutput;
import com.contentforge.domain.execution.adapter.gateway.IExecutionProgressListener;
import com.contentforge.domain.execution.adapter.gateway.IResearchProducer;
import com.contentforge.domain.execution.adapter.gateway.IStageProducer;
import com.contentforge.domain.execution.model.entity.ExecutionResultEntity;
import com.contentforge.domain.execution.model.valobj.CancellationSignal;
import com.contentforge.domain.execution.model.valobj.PipelineExecutionPolicy;
import com.contentforge.domain.execution.model.valobj.StepLedgerEntry;
import com.contentforge.domain.execution.service.FormatNegotiationDomainService;
import com.contentforge.domain.execution.service.PipelineExecutor;
import com.contentforge.domain.execution.service.QualityGateDomainService;
import com.contentforge.domain.execution.service.StageProducerRegistry;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.domain.planning.model.valobj.WorkflowTable;
import com.contentforge.domain.planning.service.WorkflowPlannerService;
import com.contentforge.test.support.RecordingProducers;
import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.OutputFormatEnum;
import com.contentforge.types.enums.PriorityEnum;
import com.contentforge.types.enums.ProducerRoleEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.RunStatusEnum;
import com.contentforge.types.enums.ToneTypeEnum;
import com.contentforge.types.enums.WorkflowShapeEnum;
import com.contentforge.types.exception.AppException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class PipelineExecutorTest {

    private static final List<ContentTypeEnum> CAMPAIGN = List.of(ContentTypeEnum.ARTICLE,
            ContentTypeEnum.SOCIAL_POST, ContentTypeEnum.EMAIL);

    private final RecordingProducers producers = new RecordingProducers();

    private ExecutorService trackPool;

    @AfterEach
    public void tearDown() {
        if (trackPool != null) {
            trackPool.shutdownNow();
        }
    }

    @Test
    public void shouldRunSingleTrackArticleThroughFiveSteps() {
        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        assertTrue(result.isSuccess());
        assertEquals(RunStatusEnum.COMPLETED, result.getStatus());
        assertEquals(List.of("research", "brief", "draft", "voice-check", "format"), ledgerSteps(result));
        for (StepLedgerEntry entry : result.getStepLedger()) {
            assertTrue(entry.success(), entry.step());
            assertNull(entry.track());
        }
        assertEquals(List.of("research_brief", "content_brief", "draft_content", "voice_check_result",
                "production_outputs"), new ArrayList<>(result.getOutputs().keySet()));
        assertEquals(1, result.getOutputList("production_outputs", ProductionOutput.class).size());
        assertEquals(List.of(OutputFormatEnum.HTML), producers.formatsProduced);
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getEndTime() != null);
    }

    @Test
    public void shouldFanOutCampaignAfterSingleResearch() {
        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(new ContentRequest("Product launch", CAMPAIGN, PriorityEnum.HIGH, null, Map.of()));

        assertTrue(result.isSuccess());
        assertEquals(1, producers.count("research"));
        assertEquals(3, producers.count("brief"));
        assertEquals(3, producers.count("draft"));
        assertEquals(3, producers.count("voice-check"));
        assertEquals(List.of("research:article",
                "brief:article", "brief:social_post", "brief:email",
                "draft:article", "draft:social_post", "draft:email",
                "voice-check:article", "voice-check:social_post", "voice-check:email",
                "format:article", "format:social_post", "format:email"), producers.snapshot());

        List<DraftContent> drafts = result.getOutputList("drafts", DraftContent.class);
        assertEquals(3, drafts.size());
        assertEquals(CAMPAIGN, drafts.stream().map(DraftContent::contentType).collect(Collectors.toList()));
        assertEquals(3, result.getOutputList("production_outputs", ProductionOutput.class).size());

        List<StepLedgerEntry> draftEntries = result.getStepLedger().stream()
                .filter(entry -> entry.step().equals("draft"))
                .collect(Collectors.toList());
        assertEquals(CAMPAIGN, draftEntries.stream().map(StepLedgerEntry::track).collect(Collectors.toList()));
        assertNull(result.getStepLedger().get(0).track());
    }

    @Test
    public void shouldContinuePastFailedGateWhenLenient() {
        producers.voiceScore = 0.5D;

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        StepLedgerEntry voiceCheck = result.getStepLedger().get(3);
        assertEquals("voice-check", voiceCheck.step());
        assertFalse(voiceCheck.success());
        assertTrue(voiceCheck.error().startsWith("Brand voice quality gate failed"));
        assertEquals(ArtifactKindEnum.VOICE_CHECK_RESULT, voiceCheck.outputKind());
        assertEquals(1, producers.count("format"));
        assertTrue(result.getStepLedger().get(4).success());
        assertTrue(result.isSuccess());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).startsWith("voice-check: "));
    }

    @Test
    public void shouldStopAtFailedGateWhenStrict() {
        producers.voiceScore = 0.5D;

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.strict())
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        assertFalse(result.isSuccess());
        assertEquals(RunStatusEnum.FAILED, result.getStatus());
        assertEquals(List.of("research", "brief", "draft", "voice-check"), ledgerSteps(result));
        assertEquals(0, producers.count("format"));
        assertFalse(result.getOutputs().containsKey("production_outputs"));
        assertTrue(result.getFailureMessage().startsWith("voice-check: Brand voice quality gate failed"));
    }

    @Test
    public void shouldStopFanOutAtFirstFailedTrackWhenStrict() {
        producers.voiceScore = 0.5D;

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.strict())
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertEquals(RunStatusEnum.FAILED, result.getStatus());
        assertEquals(1, producers.count("voice-check"));
        assertEquals(0, producers.count("format"));
    }

    @Test
    public void shouldRunParallelTracksConcurrentlyButRecordInDeclaredOrder() {
        AtomicInteger threads = new AtomicInteger();
        trackPool = Executors.newFixedThreadPool(3, runnable -> {
            Thread thread = new Thread(runnable, "track-test-" + threads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        producers.draftDelaysMs.put(ContentTypeEnum.ARTICLE, 200L);

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient(), trackPool)
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertTrue(result.isSuccess());
        assertTrue(producers.threadsByInvocation.get("draft:article").startsWith("track-test-"));
        assertFalse(producers.threadsByInvocation.get("brief:article").startsWith("track-test-"));

        List<ContentTypeEnum> draftTracks = result.getStepLedger().stream()
                .filter(entry -> entry.step().equals("draft"))
                .map(StepLedgerEntry::track)
                .collect(Collectors.toList());
        assertEquals(CAMPAIGN, draftTracks);
        assertEquals(CAMPAIGN, result.getOutputList("drafts", DraftContent.class).stream()
                .map(DraftContent::contentType).collect(Collectors.toList()));

        List<String> invocations = producers.snapshot();
        int firstVoiceCheck = invocations.indexOf("voice-check:article");
        for (ContentTypeEnum track : CAMPAIGN) {
            assertTrue(invocations.indexOf("draft:" + track.getCode()) < firstVoiceCheck);
        }
    }

    @Test
    public void shouldKeepTracksSequentialWhenParallelFanOutDisabled() {
        trackPool = Executors.newFixedThreadPool(2);
        PipelineExecutionPolicy sequential = new PipelineExecutionPolicy(false, false, OutputFormatEnum.HTML);

        ExecutionResultEntity result = executor(sequential, trackPool)
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertTrue(result.isSuccess());
        assertEquals(Thread.currentThread().getName(), producers.threadsByInvocation.get("draft:social_post"));
    }

    @Test
    public void shouldCheckCampaignVoiceAgainstFirstBriefTone() {
        producers.briefTones.put(ContentTypeEnum.ARTICLE, ToneTypeEnum.EDUCATIONAL);
        producers.briefTones.put(ContentTypeEnum.SOCIAL_POST, ToneTypeEnum.CONVERSATIONAL);

        executor(PipelineExecutionPolicy.lenient())
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertEquals(List.of(ToneTypeEnum.EDUCATIONAL, ToneTypeEnum.EDUCATIONAL, ToneTypeEnum.EDUCATIONAL),
                producers.voiceTones);
    }

    @Test
    public void shouldFailRunWhenProducerRaises() {
        producers.failingStep = "draft";

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        assertEquals(RunStatusEnum.FAILED, result.getStatus());
        assertFalse(result.isSuccess());
        StepLedgerEntry last = result.getStepLedger().get(result.getStepLedger().size() - 1);
        assertEquals("draft", last.step());
        assertFalse(last.success());
        assertNull(last.outputKind());
        assertEquals("Generation service unavailable", last.error());
        assertEquals("draft: Generation service unavailable", result.getFailureMessage());
        assertEquals(List.of("draft: Generation service unavailable"), result.getErrors());
        assertEquals(0, producers.count("voice-check"));
    }

    @Test
    public void shouldJoinEveryTrackBeforeReportingConcurrentFailure() {
        trackPool = Executors.newFixedThreadPool(3);
        producers.failingStep = "draft";
        producers.failingTrack = ContentTypeEnum.SOCIAL_POST;
        producers.draftDelaysMs.put(ContentTypeEnum.EMAIL, 100L);

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient(), trackPool)
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertEquals(RunStatusEnum.FAILED, result.getStatus());
        assertEquals(3, producers.count("draft"));
        List<StepLedgerEntry> draftEntries = result.getStepLedger().stream()
                .filter(entry -> entry.step().equals("draft"))
                .collect(Collectors.toList());
        assertEquals(CAMPAIGN, draftEntries.stream().map(StepLedgerEntry::track).collect(Collectors.toList()));
        assertTrue(draftEntries.get(0).success());
        assertFalse(draftEntries.get(1).success());
        assertEquals("Generation service unavailable", draftEntries.get(1).error());
        assertTrue(draftEntries.get(2).success());
        assertEquals("draft: Generation service unavailable", result.getFailureMessage());
        assertEquals(0, producers.count("voice-check"));
    }

    @Test
    public void shouldRecordLaterConcurrentTracksWhenFirstTrackFails() {
        trackPool = Executors.newFixedThreadPool(3);
        producers.failingStep = "draft";
        producers.failingTrack = ContentTypeEnum.ARTICLE;

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient(), trackPool)
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertEquals(RunStatusEnum.FAILED, result.getStatus());
        assertEquals(3, producers.count("draft"));
        List<StepLedgerEntry> draftEntries = result.getStepLedger().stream()
                .filter(entry -> entry.step().equals("draft"))
                .collect(Collectors.toList());
        assertEquals(3, draftEntries.size());
        assertFalse(draftEntries.get(0).success());
        assertNull(draftEntries.get(0).outputKind());
        assertTrue(draftEntries.get(1).success());
        assertTrue(draftEntries.get(2).success());
        assertEquals(List.of("draft: Generation service unavailable"), result.getErrors());
    }

    @Test
    public void shouldRunTracksOnCallerWhenTrackPoolDiscardsTasks() {
        trackPool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new ThreadPoolExecutor.DiscardPolicy());
        producers.draftDelaysMs.put(ContentTypeEnum.ARTICLE, 100L);

        ExecutionResultEntity result = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> executor(PipelineExecutionPolicy.lenient(), trackPool)
                        .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null)));

        assertTrue(result.isSuccess());
        assertEquals(3, producers.count("draft"));
        assertEquals(3, result.getOutputList("drafts", DraftContent.class).size());
    }

    @Test
    public void shouldRunRejectedTrackOnCallerWhenTrackPoolAborts() {
        trackPool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.SECONDS, new SynchronousQueue<>(),
                new ThreadPoolExecutor.AbortPolicy());
        producers.draftDelaysMs.put(ContentTypeEnum.ARTICLE, 300L);
        String caller = Thread.currentThread().getName();

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient(), trackPool)
                .execute(new ContentRequest("Product launch", CAMPAIGN, null, null, null));

        assertTrue(result.isSuccess());
        assertEquals(3, producers.count("draft"));
        assertFalse(caller.equals(producers.threadsByInvocation.get("draft:article")));
        assertEquals(caller, producers.threadsByInvocation.get("draft:social_post"));
        assertEquals(caller, producers.threadsByInvocation.get("draft:email"));
    }

    @Test
    public void shouldFailRunWhenProducerReturnsNothing() {
        IResearchProducer research = mock(IResearchProducer.class);
        when(research.role()).thenReturn(ProducerRoleEnum.RESEARCH);
        List<IStageProducer<?, ?>> stageProducers = List.of(research, producers.brief, producers.draft,
                producers.voiceCheck, producers.format);

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient(), null, stageProducers)
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        verify(research, times(1)).invoke(any(), any());
        assertEquals(RunStatusEnum.FAILED, result.getStatus());
        assertEquals("research: Producer research returned no artifact", result.getFailureMessage());
        assertEquals(0, producers.count("brief"));
    }

    @Test
    public void shouldCancelBeforeFirstStep() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel("Stopped by user");

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE), signal,
                        IExecutionProgressListener.NOOP);

        assertEquals(RunStatusEnum.CANCELLED, result.getStatus());
        assertFalse(result.isSuccess());
        assertTrue(result.getStepLedger().isEmpty());
        assertTrue(producers.snapshot().isEmpty());
        assertEquals("research: Stopped by user", result.getFailureMessage());
    }

    @Test
    public void shouldStopAtNextStepBoundaryWhenCancelledMidRun() {
        CancellationSignal signal = new CancellationSignal();
        producers.onInvoke = invocation -> {
            if (invocation.startsWith("draft")) {
                signal.cancel();
            }
        };

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE), signal, null);

        assertEquals(RunStatusEnum.CANCELLED, result.getStatus());
        assertEquals(List.of("research", "brief", "draft"), ledgerSteps(result));
        assertTrue(result.getOutputs().containsKey("draft_content"));
        assertEquals(0, producers.count("voice-check"));
        assertEquals("voice-check: Run cancelled", result.getFailureMessage());
    }

    @Test
    public void shouldProduceEveryNegotiatedFormat() {
        ContentRequest request = new ContentRequest("AI in healthcare", List.of(ContentTypeEnum.ARTICLE),
                null, null, Map.of("output_formats", "pdf,html,docx"));

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient()).execute(request);

        assertTrue(result.isSuccess());
        assertEquals(List.of(OutputFormatEnum.MARKDOWN, OutputFormatEnum.HTML), producers.formatsProduced);
        assertEquals(2, result.getOutputList("production_outputs", ProductionOutput.class).size());
        assertEquals(2, result.getStepLedger().stream().filter(entry -> entry.step().equals("format")).count());
    }

    @Test
    public void shouldRejectPlanWithUnregisteredRoleBeforeRunning() {
        List<IStageProducer<?, ?>> withoutFormat = List.of(producers.research, producers.brief, producers.draft,
                producers.voiceCheck);
        PipelineExecutor executor = executor(PipelineExecutionPolicy.lenient(), null, withoutFormat);

        AppException ex = assertThrows(AppException.class,
                () -> executor.execute(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE)));

        assertEquals(ResponseCode.PLAN_CONFIG_ERROR.getCode(), ex.getCode());
        assertTrue(producers.snapshot().isEmpty());
    }

    @Test
    public void shouldRejectMalformedWorkflowTable() {
        PipelineExecutor executor = new PipelineExecutor(
                new WorkflowPlannerService(WorkflowTable.defaults().withOverrides(
                        Map.of(WorkflowShapeEnum.SOCIAL_ONLY, List.of("research", "review")))),
                new StageProducerRegistry(producers.all()), new QualityGateDomainService(),
                new FormatNegotiationDomainService(), null, null);

        AppException ex = assertThrows(AppException.class,
                () -> executor.execute(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST)));

        assertEquals(ResponseCode.PLAN_CONFIG_ERROR.getCode(), ex.getCode());
        assertFalse(executor.getPolicy().strictQualityGates());
    }

    @Test
    public void shouldReportProgressAndSurviveFailingListener() {
        List<String> events = new ArrayList<>();
        IExecutionProgressListener listener = new IExecutionProgressListener() {
            @Override
            public void onRunStarted(ExecutionPlan plan) {
                events.add("started:" + plan.size());
            }

            @Override
            public void onStepRecorded(PlanStep step, StepLedgerEntry entry) {
                events.add(entry.step());
                throw new IllegalStateException("listener broke");
            }
        };

        ExecutionResultEntity result = executor(PipelineExecutionPolicy.lenient())
                .execute(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST), new CancellationSignal(), listener);

        assertTrue(result.isSuccess());
        assertEquals(List.of("started:4", "research", "brief", "draft", "voice-check"), events);
    }

    private PipelineExecutor executor(PipelineExecutionPolicy policy) {
        return executor(policy, null);
    }

    private PipelineExecutor executor(PipelineExecutionPolicy policy, ExecutorService trackExecutor) {
        return executor(policy, trackExecutor, producers.all());
    }

    private PipelineExecutor executor(PipelineExecutionPolicy policy, ExecutorService trackExecutor,
                                      List<IStageProducer<?, ?>> stageProducers) {
        return new PipelineExecutor(new WorkflowPlannerService(WorkflowTable.defaults()),
                new StageProducerRegistry(stageProducers), new QualityGateDomainService(),
                new FormatNegotiationDomainService(), policy, trackExecutor);
    }

    private List<String> ledgerSteps(ExecutionResultEntity result) {
        return result.getStepLedger().stream().map(StepLedgerEntry::step).collect(Collectors.toList());
    }
}
