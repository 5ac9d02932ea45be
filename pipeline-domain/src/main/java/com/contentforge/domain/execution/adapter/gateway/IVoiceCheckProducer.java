package com.contentforge.domain.execution.adapter.gateway;

import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.VoiceCheckResult;
import com.contentforge.types.enums.ProducerRoleEnum;

/**
 * Voice-check role. The tone to check against arrives as {@code context.targetTone()}.
 */
public interface IVoiceCheckProducer extends IStageProducer<DraftContent, VoiceCheckResult> {

    @Override
    default ProducerRoleEnum role() {
        return ProducerRoleEnum.VOICE_CHECK;
    }
}
