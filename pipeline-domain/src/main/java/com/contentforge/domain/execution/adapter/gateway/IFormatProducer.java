package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.ProductionOutput;
import com.contentforge.types.enums.OutputFormatEnum;
import com.contentforge.types.enums.ProducerRoleEnum;

import java.util.Set;

/**
 * Format role. Which formats can be produced is a queryable capability; the executor only ever
 * asks for a supported format, passed as {@code context.outputFormat()}.
 */
public interface IFormatProducer extends IStageProducer<DraftContent, ProductionOutput> {

    @Override
    default ProducerRoleEnum role() {
        return ProducerRoleEnum.FORMAT;
    }

    Set<OutputFormatEnum> supportedFormats();

    /**
     * Format used in place of an unsupported request. Must be one of {@link #supportedFormats()}.
     */
    OutputFormatEnum fallbackFormat();

    default boolean supports(OutputFormatEnum format) {
        return format != null && supportedFormats().contains(format);
    }
}
