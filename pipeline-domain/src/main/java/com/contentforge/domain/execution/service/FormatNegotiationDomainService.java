package com.contentforge.domain.execution.service;

import com.contentforge.domain.execution.adapter.gateway.IFormatProducer;
import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.OutputFormatEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Format negotiation: which formats a request asks for, and which of them the format producer can
 * actually deliver.
 */
@Slf4j
@Service
public class FormatNegotiationDomainService {

    public static final String OUTPUT_FORMATS_KEY = "output_formats";
    public static final String OUTPUT_FORMAT_KEY = "output_format";

    /**
     * Formats named by the request context, in declared order. {@code output_formats} wins over
     * {@code output_format}; an entry that names no known format is kept as {@code null} so that it
     * negotiates to the producer's fallback.
     */
    public List<OutputFormatEnum> resolveRequestedFormats(Map<String, Object> context, OutputFormatEnum defaultFormat) {
        List<OutputFormatEnum> requested = new ArrayList<>();
        if (context != null) {
            collect(context.get(OUTPUT_FORMATS_KEY), requested);
            if (requested.isEmpty()) {
                collect(context.get(OUTPUT_FORMAT_KEY), requested);
            }
        }
        if (requested.isEmpty()) {
            requested.add(defaultFormat == null ? OutputFormatEnum.HTML : defaultFormat);
        }
        return requested;
    }

    public OutputFormatEnum negotiate(OutputFormatEnum requested, IFormatProducer producer) {
        if (producer.supports(requested)) {
            return requested;
        }
        OutputFormatEnum fallback = producer.fallbackFormat();
        log.warn("Requested format not supported, using fallback. requested={}, fallback={}, supported={}",
                requested == null ? null : requested.getCode(),
                fallback == null ? null : fallback.getCode(),
                producer.supportedFormats());
        return fallback;
    }

    /**
     * Negotiate every requested format; duplicates produced by fallback collapse in first-seen order.
     */
    public List<OutputFormatEnum> negotiateAll(List<OutputFormatEnum> requested, IFormatProducer producer) {
        LinkedHashSet<OutputFormatEnum> negotiated = new LinkedHashSet<>();
        for (OutputFormatEnum format : requested) {
            OutputFormatEnum resolved = negotiate(format, producer);
            if (resolved != null) {
                negotiated.add(resolved);
            }
        }
        return new ArrayList<>(negotiated);
    }

    private void collect(Object value, List<OutputFormatEnum> target) {
        if (value == null) {
            return;
        }
        if (value instanceof OutputFormatEnum format) {
            target.add(format);
            return;
        }
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                collect(item, target);
            }
            return;
        }
        String text = String.valueOf(value);
        for (String part : text.split(Constants.SPLIT)) {
            if (StringUtils.isBlank(part)) {
                continue;
            }
            target.add(parse(part));
        }
    }

    private OutputFormatEnum parse(String text) {
        try {
            return OutputFormatEnum.fromCode(text);
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown output format in request context. value={}", text);
            return null;
        }
    }
}
