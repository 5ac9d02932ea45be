package com.contentforge.test.domain;

import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanStep;
import com.contentforge.domain.planning.model.valobj.WorkflowTable;
import com.contentforge.domain.planning.service.WorkflowPlannerService;
import com.contentforge.types.enums.ArtifactKindEnum;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.QualityGateEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.WorkflowShapeEnum;
import com.contentforge.types.exception.AppException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class WorkflowPlannerServiceTest {

    private final WorkflowPlannerService planner = new WorkflowPlannerService(WorkflowTable.defaults());

    @Test
    public void shouldClassifyEveryMultiKindRequestAsCampaign() {
        for (ContentTypeEnum first : ContentTypeEnum.values()) {
            for (ContentTypeEnum second : ContentTypeEnum.values()) {
                if (first == second) {
                    continue;
                }
                assertEquals(WorkflowShapeEnum.MULTI_TARGET_CAMPAIGN,
                        planner.classify(ContentRequest.of("Topic", first, second)),
                        first + "+" + second);
            }
        }
    }

    @Test
    public void shouldClassifySingleKindRequests() {
        assertEquals(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, classify(ContentTypeEnum.ARTICLE));
        assertEquals(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, classify(ContentTypeEnum.BLOG_POST));
        assertEquals(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, classify(ContentTypeEnum.WHITEPAPER));
        assertEquals(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, classify(ContentTypeEnum.CASE_STUDY));
        assertEquals(WorkflowShapeEnum.PRESENTATION, classify(ContentTypeEnum.PRESENTATION));
        assertEquals(WorkflowShapeEnum.SOCIAL_ONLY, classify(ContentTypeEnum.SOCIAL_POST));
        assertEquals(WorkflowShapeEnum.EMAIL_SEQUENCE, classify(ContentTypeEnum.EMAIL));
        assertEquals(WorkflowShapeEnum.EMAIL_SEQUENCE, classify(ContentTypeEnum.NEWSLETTER));
        assertEquals(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, classify(ContentTypeEnum.VIDEO_SCRIPT));
    }

    @Test
    public void shouldCollapseRepeatedKindToSingleTrack() {
        ContentRequest request = new ContentRequest("Topic",
                List.of(ContentTypeEnum.SOCIAL_POST, ContentTypeEnum.SOCIAL_POST), null, null, null);

        assertEquals(List.of(ContentTypeEnum.SOCIAL_POST), request.contentTypes());
        assertEquals(WorkflowShapeEnum.SOCIAL_ONLY, planner.classify(request));
    }

    @Test
    public void shouldRejectRequestWithoutContentTypes() {
        AppException ex = assertThrows(AppException.class,
                () -> new ContentRequest("Topic", List.of(), null, null, null));
        assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldPlanFullSingleTrackSequence() {
        ExecutionPlan plan = planner.plan(ContentRequest.of("  AI in healthcare  ", ContentTypeEnum.ARTICLE));

        assertEquals(WorkflowShapeEnum.SINGLE_TRACK_PRODUCTION, plan.shape());
        assertEquals(List.of("research", "brief", "draft", "voice-check", "format"), names(plan));
        assertEquals("AI in healthcare", plan.requirements().topic());
        for (PlanStep step : plan.steps()) {
            assertFalse(step.isFanOut());
            assertFalse(step.parallel());
            assertTrue(step.hasGate());
        }
        assertEquals(ArtifactKindEnum.REQUEST, plan.steps().get(0).inputKind());
        assertEquals(ArtifactKindEnum.DRAFT_CONTENT, plan.steps().get(4).inputKind());
        assertEquals(QualityGateEnum.FORMAT_COMPLIANCE, plan.steps().get(4).gate());
    }

    @Test
    public void shouldPlanShortenedShapes() {
        assertEquals(List.of("research", "brief", "draft", "format"),
                names(planner.plan(ContentRequest.of("Deck", ContentTypeEnum.PRESENTATION))));
        assertEquals(List.of("research", "brief", "draft", "voice-check"),
                names(planner.plan(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST))));
        assertEquals(List.of("research", "brief", "draft", "voice-check", "format"),
                names(planner.plan(ContentRequest.of("Launch", ContentTypeEnum.EMAIL))));
    }

    @Test
    public void shouldFanOutEveryCampaignStepAfterResearch() {
        ExecutionPlan plan = planner.plan(ContentRequest.of("Launch",
                ContentTypeEnum.ARTICLE, ContentTypeEnum.SOCIAL_POST, ContentTypeEnum.EMAIL));
        List<ContentTypeEnum> tracks = List.of(ContentTypeEnum.ARTICLE, ContentTypeEnum.SOCIAL_POST,
                ContentTypeEnum.EMAIL);

        PlanStep research = plan.steps().get(0);
        assertFalse(research.isFanOut());
        assertNull(research.tracks());
        for (PlanStep step : plan.steps().subList(1, plan.size())) {
            assertEquals(tracks, step.tracks(), step.stepName());
        }
        assertTrue(plan.steps().get(2).parallel());
        assertFalse(plan.steps().get(1).parallel());
        assertEquals("drafts", plan.steps().get(2).outputKey());
    }

    @Test
    public void shouldBuildIdenticalPlansForIdenticalRequests() {
        ContentRequest request = ContentRequest.of("Launch", ContentTypeEnum.ARTICLE, ContentTypeEnum.EMAIL);

        assertEquals(planner.plan(request), planner.plan(request));
    }

    @Test
    public void shouldRejectUnknownStepName() {
        WorkflowPlannerService custom = plannerWith(WorkflowShapeEnum.SOCIAL_ONLY, List.of("research", "publish"));

        AppException ex = assertThrows(AppException.class,
                () -> custom.plan(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST)));

        assertEquals(ResponseCode.PLAN_CONFIG_ERROR.getCode(), ex.getCode());
        assertTrue(ex.getMessage().contains("Unknown step: publish"));
    }

    @Test
    public void shouldRejectStepWhoseInputIsNeverProduced() {
        WorkflowPlannerService custom = plannerWith(WorkflowShapeEnum.SOCIAL_ONLY, List.of("research", "draft"));

        AppException ex = assertThrows(AppException.class,
                () -> custom.plan(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST)));

        assertEquals(ResponseCode.PLAN_CONFIG_ERROR.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectDuplicateAndEmptySequences() {
        WorkflowPlannerService duplicate = plannerWith(WorkflowShapeEnum.SOCIAL_ONLY,
                List.of("research", "brief", "brief"));
        WorkflowPlannerService empty = plannerWith(WorkflowShapeEnum.SOCIAL_ONLY, List.of());

        assertThrows(AppException.class, () -> duplicate.plan(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST)));
        assertThrows(AppException.class, () -> empty.plan(ContentRequest.of("Launch", ContentTypeEnum.SOCIAL_POST)));
    }

    @Test
    public void shouldAcceptStepAliasesInOverrides() {
        WorkflowPlannerService custom = plannerWith(WorkflowShapeEnum.PRESENTATION,
                List.of("research", "content_brief", "creation", "production"));

        assertEquals(List.of("research", "brief", "draft", "format"),
                names(custom.plan(ContentRequest.of("Deck", ContentTypeEnum.PRESENTATION))));
    }

    private WorkflowShapeEnum classify(ContentTypeEnum contentType) {
        return planner.classify(ContentRequest.of("Topic", contentType));
    }

    private WorkflowPlannerService plannerWith(WorkflowShapeEnum shape, List<String> sequence) {
        return new WorkflowPlannerService(WorkflowTable.defaults().withOverrides(Map.of(shape, sequence)));
    }

    private List<String> names(ExecutionPlan plan) {
        return plan.steps().stream().map(PlanStep::stepName).collect(Collectors.toList());
    }
}
