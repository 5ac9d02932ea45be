package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.content.model.valobj.ResearchBrief;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.types.enums.ProducerRoleEnum;

/**
 * Research role: request in, research brief out.
 */
public interface IResearchProducer extends IStageProducer<ContentRequest, ResearchBrief> {

    @Override
    default ProducerRoleEnum role() {
        return ProducerRoleEnum.RESEARCH;
    }
}
