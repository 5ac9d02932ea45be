package com.contentforge.domain.execution.model.valobj;

import com.contentforge.domain.planning.model.valobj.PlanRequirements;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.OutputFormatEnum;
import com.contentforge.types.enums.PriorityEnum;
import com.contentforge.types.enums.ToneTypeEnum;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Context handed to a producer with its input artifact.
 *
 * @param track        content kind of the track being produced
 * @param fanOut       whether the step runs one track per requested kind
 * @param targetTone   voice-check only
 * @param outputFormat format step only, always a format the producer supports
 */
public record StageContext(String stepName,
                           String topic,
                           ContentTypeEnum track,
                           boolean fanOut,
                           PriorityEnum priority,
                           LocalDateTime deadline,
                           Map<String, Object> requestContext,
                           ToneTypeEnum targetTone,
                           OutputFormatEnum outputFormat) {

    public StageContext {
        requestContext = requestContext == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requestContext));
    }

    public static StageContext forStep(String stepName, PlanRequirements requirements, ContentTypeEnum track,
                                       boolean fanOut) {
        return new StageContext(stepName, requirements.topic(), track, fanOut, requirements.priority(),
                requirements.deadline(), requirements.context(), null, null);
    }

    public StageContext withTargetTone(ToneTypeEnum tone) {
        return new StageContext(stepName, topic, track, fanOut, priority, deadline, requestContext, tone, outputFormat);
    }

    public StageContext withOutputFormat(OutputFormatEnum format) {
        return new StageContext(stepName, topic, track, fanOut, priority, deadline, requestContext, targetTone, format);
    }

    public Object contextValue(String key) {
        return requestContext.get(key);
    }
}
