package com.contentforge.domain.planning.model.valobj;

import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.PriorityEnum;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requirements parsed from a request; the only request data plan expansion may depend on.
 */
public record PlanRequirements(String topic,
                               List<ContentTypeEnum> contentTypes,
                               PriorityEnum priority,
                               LocalDateTime deadline,
                               Map<String, Object> context) {

    public PlanRequirements {
        contentTypes = contentTypes == null ? List.of() : List.copyOf(contentTypes);
        context = context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
