package com.contentforge.config;

import com.contentforge.domain.execution.adapter.gateway.IFormatProducer;
import com.contentforge.domain.execution.service.StageProducerRegistry;
import com.contentforge.domain.planning.model.valobj.ExecutionPlan;
import com.contentforge.domain.planning.model.valobj.PlanRequirements;
import com.contentforge.domain.planning.service.PlannerService;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.PriorityEnum;
import com.contentforge.types.enums.ProducerRoleEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.WorkflowShapeEnum;
import com.contentforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Startup check: every workflow shape must expand into a valid plan whose producer roles are all
 * registered, and the format producer's fallback must be one of its own formats.
 */
@Slf4j
@Component
public class WorkflowTableHealthCheckRunner implements ApplicationRunner {

    private final PlannerService plannerService;
    private final StageProducerRegistry stageProducerRegistry;
    private final boolean enabled;

    public WorkflowTableHealthCheckRunner(PlannerService plannerService,
                                          StageProducerRegistry stageProducerRegistry,
                                          @Value("${pipeline.startup-check.enabled:true}") boolean enabled) {
        this.plannerService = plannerService;
        this.stageProducerRegistry = stageProducerRegistry;
        this.enabled = enabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!enabled) {
            log.info("Skip workflow table health check because pipeline.startup-check.enabled=false");
            return;
        }
        PlanRequirements sample = new PlanRequirements("startup check",
                List.of(ContentTypeEnum.ARTICLE, ContentTypeEnum.SOCIAL_POST), PriorityEnum.NORMAL, null, Map.of());
        for (WorkflowShapeEnum shape : WorkflowShapeEnum.values()) {
            ExecutionPlan plan = plannerService.buildPlan(shape, sample);
            stageProducerRegistry.ensureRegistered(plan);
            log.info("Workflow checked. shape={}, steps={}", shape.getCode(),
                    plan.steps().stream().map(step -> step.stepName()).toList());
        }
        if (stageProducerRegistry.isRegistered(ProducerRoleEnum.FORMAT)) {
            IFormatProducer formatProducer = stageProducerRegistry.require(ProducerRoleEnum.FORMAT, IFormatProducer.class);
            if (!formatProducer.supports(formatProducer.fallbackFormat())) {
                throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                        "Format producer fallback " + formatProducer.fallbackFormat() + " is not a supported format");
            }
        }
        log.info("Workflow table health check passed. roles={}", stageProducerRegistry.registeredRoles());
    }
}
