package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.content.model.valobj.ContentBrief;
import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.types.enums.ProducerRoleEnum;

public interface IDraftProducer extends IStageProducer<ContentBrief, DraftContent> {

    @Override
    default ProducerRoleEnum role() {
        return ProducerRoleEnum.DRAFT;
    }
}
