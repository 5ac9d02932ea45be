package com.contentforge.test;

import com.contentforge.api.dto.PipelineJobDTO;
import com.contentforge.api.dto.PlanStepDTO;
import com.contentforge.domain.execution.model.valobj.PipelineExecutionPolicy;
import com.contentforge.domain.execution.service.FormatNegotiationDomainService;
import com.contentforge.domain.execution.service.PipelineExecutor;
import com.contentforge.domain.execution.service.QualityGateDomainService;
import com.contentforge.domain.execution.service.StageProducerRegistry;
import com.contentforge.domain.job.adapter.repository.IPipelineJobRepository;
import com.contentforge.domain.job.model.entity.PipelineJobEntity;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.WorkflowTable;
import com.contentforge.domain.planning.service.WorkflowPlannerService;
import com.contentforge.infrastructure.repository.job.PipelineJobRepositoryImpl;
import com.contentforge.test.support.RecordingProducers;
import com.contentforge.trigger.application.command.PipelineJobCommandService;
import com.contentforge.trigger.application.common.ExecutionResultViewAssembler;
import com.contentforge.trigger.application.query.PipelineJobQueryService;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.JobStatusEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.WorkflowShapeEnum;
import com.contentforge.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PipelineJobCommandServiceTest {

    private final RecordingProducers producers = new RecordingProducers();

    private final WorkflowPlannerService planner = new WorkflowPlannerService(WorkflowTable.defaults());

    private final Cache<String, PipelineJobEntity> jobCache = CacheBuilder.newBuilder().maximumSize(100).build();

    private final IPipelineJobRepository repository = new PipelineJobRepositoryImpl(jobCache);

    private final PipelineJobQueryService queryService = new PipelineJobQueryService(repository, planner,
            new ExecutionResultViewAssembler(new ObjectMapper()
                    .registerModule(new JavaTimeModule())
                    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)));

    private final List<Runnable> queued = new ArrayList<>();

    @Test
    public void shouldRunSubmittedJobToCompletion() {
        PipelineJobCommandService commandService = commandService(Runnable::run);

        String runId = commandService.submit(ContentRequest.of("Product launch",
                ContentTypeEnum.ARTICLE, ContentTypeEnum.SOCIAL_POST));

        PipelineJobDTO job = queryService.findJob(runId);
        assertEquals("completed", job.getStatus());
        assertEquals("multi_target_campaign", job.getWorkflowShape());
        assertEquals(List.of("article", "social_post"), job.getContentTypes());
        assertEquals(100, job.getProgress());
        assertEquals(5, job.getCompletedSteps());
        assertEquals("format", job.getCurrentStep());
        assertTrue(job.getResult().isSuccess());
        assertEquals(9, job.getResult().getStepLedger().size());
        assertEquals(2, ((List<?>) job.getResult().getOutputs().get("drafts")).size());
        assertEquals(0, commandService.activeRunCount());
    }

    @Test
    public void shouldExposeProgressWithoutResultWhileRunning() {
        PipelineJobCommandService commandService = commandService(queued::add);
        List<PipelineJobDTO> snapshots = new ArrayList<>();
        producers.onInvoke = invocation -> {
            if (invocation.startsWith("draft")) {
                snapshots.add(queryService.findJob(onlyRunId()));
            }
        };

        String runId = commandService.submit(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST));
        assertEquals("pending", queryService.findJob(runId).getStatus());
        queued.remove(0).run();

        PipelineJobDTO whileDrafting = snapshots.get(0);
        assertEquals("running", whileDrafting.getStatus());
        assertEquals("brief", whileDrafting.getCurrentStep());
        assertEquals(50, whileDrafting.getProgress());
        assertNull(whileDrafting.getResult());
        assertEquals("completed", queryService.findJob(runId).getStatus());
    }

    @Test
    public void shouldCancelQueuedJobBeforeItStarts() {
        PipelineJobCommandService commandService = commandService(queued::add);
        String runId = commandService.submit(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        assertTrue(commandService.cancel(runId));
        queued.remove(0).run();

        PipelineJobDTO job = queryService.findJob(runId);
        assertEquals("cancelled", job.getStatus());
        assertEquals("Run cancelled", job.getErrorMessage());
        assertTrue(producers.snapshot().isEmpty());
        assertFalse(commandService.cancel(runId));
    }

    @Test
    public void shouldReportFailedRunOnJob() {
        producers.failingStep = "research";
        PipelineJobCommandService commandService = commandService(Runnable::run);

        String runId = commandService.submit(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE));

        PipelineJobDTO job = queryService.findJob(runId);
        assertEquals("failed", job.getStatus());
        assertEquals("research: Generation service unavailable", job.getErrorMessage());
        assertFalse(job.getResult().isSuccess());
        assertEquals("failed", job.getResult().getStatus());
    }

    @Test
    public void shouldFailJobWhenWorkersRejectIt() {
        PipelineJobCommandService commandService = commandService(command -> {
            throw new RejectedExecutionException("queue full");
        });

        AppException ex = assertThrows(AppException.class,
                () -> commandService.submit(ContentRequest.of("AI in healthcare", ContentTypeEnum.ARTICLE)));

        assertEquals(ResponseCode.UN_ERROR.getCode(), ex.getCode());
        assertEquals(1L, repository.size());
        assertEquals(JobStatusEnum.FAILED, repository.findByRunId(onlyRunId()).getStatus());
        assertEquals(0, commandService.activeRunCount());
    }

    @Test
    public void shouldRejectUnknownRunId() {
        PipelineJobCommandService commandService = commandService(Runnable::run);

        AppException cancel = assertThrows(AppException.class, () -> commandService.cancel("missing"));
        AppException find = assertThrows(AppException.class, () -> queryService.findJob("missing"));

        assertEquals(ResponseCode.JOB_NOT_FOUND.getCode(), cancel.getCode());
        assertEquals(ResponseCode.JOB_NOT_FOUND.getCode(), find.getCode());
    }

    @Test
    public void shouldRejectUnplannableRequestWithoutTrackingIt() {
        PipelineJobCommandService commandService = new PipelineJobCommandService(executor(),
                new WorkflowPlannerService(WorkflowTable.defaults().withOverrides(
                        Map.of(WorkflowShapeEnum.SOCIAL_ONLY, List.of("draft")))),
                repository, Runnable::run);

        AppException ex = assertThrows(AppException.class,
                () -> commandService.submit(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST)));

        assertEquals(ResponseCode.PLAN_CONFIG_ERROR.getCode(), ex.getCode());
        assertEquals(0L, repository.size());
    }

    @Test
    public void shouldPreviewPlanWithoutRunningIt() {
        List<PlanStepDTO> steps = queryService.previewPlan(ContentRequest.of("Launch",
                ContentTypeEnum.ARTICLE, ContentTypeEnum.EMAIL));

        assertEquals(5, steps.size());
        assertEquals("research", steps.get(0).getStepName());
        assertNull(steps.get(0).getTracks());
        assertEquals("draft", steps.get(2).getStepName());
        assertTrue(steps.get(2).isParallel());
        assertEquals(List.of("article", "email"), steps.get(2).getTracks());
        assertEquals("brand_consistency", steps.get(3).getGateName());
        assertNotNull(steps.get(4).getOutputKind());
        assertTrue(producers.snapshot().isEmpty());
        assertEquals(0L, queryService.trackedJobCount());
    }

    private PipelineJobCommandService commandService(Executor runWorker) {
        return new PipelineJobCommandService(executor(), planner, repository, runWorker);
    }

    private PipelineExecutor executor() {
        return new PipelineExecutor(planner, new StageProducerRegistry(producers.all()),
                new QualityGateDomainService(), new FormatNegotiationDomainService(),
                PipelineExecutionPolicy.lenient(), null);
    }

    private String onlyRunId() {
        return jobCache.asMap().keySet().iterator().next();
    }
}
