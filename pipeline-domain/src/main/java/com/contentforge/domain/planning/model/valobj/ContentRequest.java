package com.contentforge.domain.planning.model.valobj;

import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.PriorityEnum;
import com.contentforge.types.enums.ResponseCode;
import com.contentforge.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * A content request. Immutable once built; requested kinds keep their declared order with
 * duplicates removed.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public record ContentRequest(String requestText,
                             List<ContentTypeEnum> contentTypes,
                             PriorityEnum priority,
                             LocalDateTime deadline,
                             Map<String, Object> context) {

    public ContentRequest {
        if (StringUtils.isBlank(requestText)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Request text is required");
        }
        if (contentTypes == null || contentTypes.isEmpty()) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "At least one content type is required");
        }
        LinkedHashSet<ContentTypeEnum> ordered = new LinkedHashSet<>();
        for (ContentTypeEnum contentType : contentTypes) {
            if (contentType == null) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(), "Content type cannot be null");
            }
            ordered.add(contentType);
        }
        contentTypes = List.copyOf(new ArrayList<>(ordered));
        priority = priority == null ? PriorityEnum.NORMAL : priority;
        context = context == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static ContentRequest of(String requestText, ContentTypeEnum... contentTypes) {
        return new ContentRequest(requestText, List.of(contentTypes), PriorityEnum.NORMAL, null, Map.of());
    }

    public ContentTypeEnum primaryContentType() {
        return contentTypes.get(0);
    }
}
