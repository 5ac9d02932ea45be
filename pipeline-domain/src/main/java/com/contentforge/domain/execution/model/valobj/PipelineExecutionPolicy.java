package com.contentforge.domain.execution.model.valobj;

import com.contentforge.types.enums.OutputFormatEnum;

/**
 * Enforcement and dispatch settings of the executor.
 *
 * @param strictQualityGates gate failures end the run instead of being recorded and skipped
 * @param parallelFanOut     tracks of a step flagged parallel are dispatched concurrently
 * @param defaultOutputFormat format requested when the request context names none
 */
public record PipelineExecutionPolicy(boolean strictQualityGates,
                                      boolean parallelFanOut,
                                      OutputFormatEnum defaultOutputFormat) {

    public PipelineExecutionPolicy {
        defaultOutputFormat = defaultOutputFormat == null ? OutputFormatEnum.HTML : defaultOutputFormat;
    }

    // TODO: lenient default kept pending product review of whether failed gates may ship output
    public static PipelineExecutionPolicy lenient() {
        return new PipelineExecutionPolicy(false, true, OutputFormatEnum.HTML);
    }

    public static PipelineExecutionPolicy strict() {
        return new PipelineExecutionPolicy(true, true, OutputFormatEnum.HTML);
    }
}
