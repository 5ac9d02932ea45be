package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.content.model.valobj.ContentBrief;
import com.contentforge.domain.content.model.valobj.ResearchBrief;
import com.contentforge.types.enums.ProducerRoleEnum;

/**
 * Brief role: one brief per content kind, the kind is read from {@code context.track()}.
 */
public interface IBriefProducer extends IStageProducer<ResearchBrief, ContentBrief> {

    @Override
    default ProducerRoleEnum role() {
        return ProducerRoleEnum.BRIEF;
    }
}
