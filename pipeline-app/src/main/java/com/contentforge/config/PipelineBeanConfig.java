package com.contentforge.config;

import com.contentforge.domain.execution.model.valobj.PipelineExecutionPolicy;
import com.contentforge.domain.execution.service.FormatNegotiationDomainService;
import com.contentforge.domain.execution.service.PipelineExecutor;
import com.contentforge.domain.execution.service.QualityGateDomainService;
import com.contentforge.domain.execution.service.StageProducerRegistry;
import com.contentforge.domain.planning.model.valobj.WorkflowTable;
import com.contentforge.domain.planning.service.PlannerService;
import com.contentforge.types.enums.OutputFormatEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.enums.WorkflowShapeEnum;
import com.contentforge.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Engine wiring: workflow table, enforcement policy and the executor.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineBeanConfig {

    /**
     * Default table with configured overrides applied. Step names are checked when plans are built
     * (at the latest by the startup check); an unknown shape code fails here.
     */
    @Bean
    public WorkflowTable workflowTable(PipelineProperties properties) {
        Map<String, List<String>> configured = properties.getPlan().getWorkflows();
        if (configured == null || configured.isEmpty()) {
            return WorkflowTable.defaults();
        }
        Map<WorkflowShapeEnum, List<String>> overrides = new EnumMap<>(WorkflowShapeEnum.class);
        for (Map.Entry<String, List<String>> entry : configured.entrySet()) {
            WorkflowShapeEnum shape;
            try {
                shape = WorkflowShapeEnum.fromCode(entry.getKey());
            } catch (IllegalArgumentException ex) {
                throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                        "Unknown workflow shape in pipeline.plan.workflows: " + entry.getKey(), ex);
            }
            overrides.put(shape, entry.getValue());
            log.info("Workflow override configured. shape={}, steps={}", shape.getCode(), entry.getValue());
        }
        return WorkflowTable.defaults().withOverrides(overrides);
    }

    @Bean
    public PipelineExecutionPolicy pipelineExecutionPolicy(PipelineProperties properties) {
        PipelineProperties.Executor executor = properties.getExecutor();
        OutputFormatEnum defaultFormat;
        try {
            defaultFormat = OutputFormatEnum.fromCode(executor.getDefaultOutputFormat());
        } catch (IllegalArgumentException ex) {
            throw new AppException(ResponseCode.PLAN_CONFIG_ERROR.getCode(),
                    "Unknown pipeline.executor.default-output-format: " + executor.getDefaultOutputFormat(), ex);
        }
        PipelineExecutionPolicy policy = new PipelineExecutionPolicy(
                executor.isStrictQualityGates(), executor.isParallelFanOut(), defaultFormat);
        if (!policy.strictQualityGates()) {
            log.warn("Quality gates run in lenient mode: gate failures are recorded and runs continue");
        }
        return policy;
    }

    @Bean
    public PipelineExecutor pipelineExecutor(PlannerService plannerService,
                                             StageProducerRegistry stageProducerRegistry,
                                             QualityGateDomainService qualityGateDomainService,
                                             FormatNegotiationDomainService formatNegotiationDomainService,
                                             PipelineExecutionPolicy pipelineExecutionPolicy,
                                             @Qualifier("pipelineTrackWorker") Executor pipelineTrackWorker) {
        return new PipelineExecutor(plannerService, stageProducerRegistry, qualityGateDomainService,
                formatNegotiationDomainService, pipelineExecutionPolicy, pipelineTrackWorker);
    }
}
