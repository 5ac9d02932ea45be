package com.contentforge.infrastructure.producer;

import com.contentforge.domain.content.model.valobj.ContentBrief;
import com.contentforge.domain.content.model.valobj.ResearchBrief;
import com.contentforge.domain.content.model.valobj.Source;
import com.contentforge.domain.content.model.valobj.WordCountRange;
import com.contentforge.domain.execution.adapter.gateway.IBriefProducer;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.ContentTypeEnum;
import com.contentforge.types.enums.ToneTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Brief producer driven by per-kind templates: section structure, word count range and tone.
 * The request context may override audience, tone and word count range.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Component
public class TemplateBriefProducer implements IBriefProducer {

    public static final String TARGET_AUDIENCE_KEY = "target_audience";
    public static final String TONE_KEY = "tone";
    public static final String WORD_COUNT_RANGE_KEY = "word_count_range";

    private static final int MAX_KEY_MESSAGES = 5;
    private static final Set<String> STOP_WORDS = Set.of("the", "and", "for", "with", "from", "that", "this",
            "into", "your", "their", "about", "how", "why", "what");

    private final Map<ContentTypeEnum, BriefTemplate> templates = new EnumMap<>(ContentTypeEnum.class);

    public TemplateBriefProducer() {
        templates.put(ContentTypeEnum.ARTICLE, new BriefTemplate(
                List.of("Introduction", "Problem Statement", "Key Insights", "Examples", "Key Takeaways"),
                new WordCountRange(800, 1500), ToneTypeEnum.EDUCATIONAL));
        templates.put(ContentTypeEnum.BLOG_POST, new BriefTemplate(
                List.of("Introduction", "Main Points", "Practical Tips", "Call to Action"),
                new WordCountRange(600, 1200), ToneTypeEnum.CONVERSATIONAL));
        templates.put(ContentTypeEnum.SOCIAL_POST, new BriefTemplate(
                List.of("Hook", "Main Message", "Call to Action"),
                new WordCountRange(50, 300), ToneTypeEnum.CONVERSATIONAL));
        templates.put(ContentTypeEnum.WHITEPAPER, new BriefTemplate(
                List.of("Executive Summary", "Problem Analysis", "Solution Framework", "Supporting Data",
                        "Implementation Guidance", "Conclusion"),
                new WordCountRange(2000, 5000), ToneTypeEnum.PROFESSIONAL));
        templates.put(ContentTypeEnum.CASE_STUDY, new BriefTemplate(
                List.of("Customer Background", "Challenge", "Solution", "Results"),
                new WordCountRange(800, 1500), ToneTypeEnum.PROFESSIONAL));
        templates.put(ContentTypeEnum.EMAIL, new BriefTemplate(
                List.of("Subject Line", "Preview Text", "Body", "Call to Action"),
                new WordCountRange(100, 400), ToneTypeEnum.CONVERSATIONAL));
        templates.put(ContentTypeEnum.NEWSLETTER, new BriefTemplate(
                List.of("Headline", "Top Story", "Quick Updates", "Call to Action"),
                new WordCountRange(300, 800), ToneTypeEnum.CONVERSATIONAL));
        templates.put(ContentTypeEnum.PRESENTATION, new BriefTemplate(
                List.of("Title Slide", "Agenda", "Key Points", "Supporting Data", "Next Steps"),
                new WordCountRange(500, 1000), ToneTypeEnum.PROFESSIONAL));
    }

    @Override
    public ContentBrief invoke(ResearchBrief input, StageContext context) {
        ContentTypeEnum contentType = context == null || context.track() == null
                ? ContentTypeEnum.ARTICLE
                : context.track();
        BriefTemplate template = templates.getOrDefault(contentType, templates.get(ContentTypeEnum.ARTICLE));

        String audience = text(context, TARGET_AUDIENCE_KEY);
        ToneTypeEnum tone = tone(context, template.tone());
        WordCountRange range = wordCountRange(context == null ? null : context.contextValue(WORD_COUNT_RANGE_KEY),
                template.wordCountRange());

        ContentBrief brief = new ContentBrief(contentType,
                StringUtils.defaultIfBlank(audience, inferAudience(input.topic())),
                keyMessages(input),
                tone,
                template.sections(),
                range,
                seoKeywords(input),
                Map.of());
        log.debug("Brief assembled. contentType={}, tone={}, range={}, messages={}",
                contentType.getCode(), tone.getCode(), range, brief.keyMessages().size());
        return brief;
    }

    private String inferAudience(String topic) {
        String lower = StringUtils.defaultString(topic).toLowerCase(Locale.ROOT);
        if (StringUtils.containsAny(lower, "technical", "engineering", "development")) {
            return "Technical professionals and engineers";
        }
        if (StringUtils.containsAny(lower, "business", "strategy", "executive")) {
            return "Business leaders and decision-makers";
        }
        if (StringUtils.containsAny(lower, "beginner", "introduction", "basics")) {
            return "Beginners and general audience";
        }
        return "General professional audience";
    }

    private List<String> keyMessages(ResearchBrief research) {
        List<String> messages = new ArrayList<>(research.keyFindings());
        if (messages.isEmpty()) {
            for (Source source : research.sources()) {
                if (!source.keyFacts().isEmpty()) {
                    messages.add(source.keyFacts().get(0));
                }
            }
        }
        return messages.subList(0, Math.min(messages.size(), MAX_KEY_MESSAGES));
    }

    private List<String> seoKeywords(ResearchBrief research) {
        LinkedHashSet<String> keywords = new LinkedHashSet<>();
        String topic = StringUtils.defaultString(research.topic()).toLowerCase(Locale.ROOT).trim();
        if (!topic.isEmpty()) {
            keywords.add(topic);
        }
        for (String word : topic.split("[^a-z0-9]+")) {
            if (word.length() > 3 && !STOP_WORDS.contains(word)) {
                keywords.add(word);
            }
        }
        return new ArrayList<>(keywords).subList(0, Math.min(keywords.size(), 8));
    }

    private ToneTypeEnum tone(StageContext context, ToneTypeEnum fallback) {
        String requested = text(context, TONE_KEY);
        if (requested == null) {
            return fallback;
        }
        try {
            ToneTypeEnum tone = ToneTypeEnum.fromText(requested);
            return tone == null ? fallback : tone;
        } catch (IllegalArgumentException ex) {
            log.warn("Unknown tone requested, using template tone. tone={}, fallback={}", requested, fallback.getCode());
            return fallback;
        }
    }

    /**
     * Accepts "min-max", "min,max", a two-element list or a {@link WordCountRange}.
     */
    private WordCountRange wordCountRange(Object value, WordCountRange fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof WordCountRange range) {
            return range;
        }
        List<String> parts = new ArrayList<>();
        if (value instanceof Iterable<?> items) {
            for (Object item : items) {
                parts.add(String.valueOf(item).trim());
            }
        } else {
            for (String part : String.valueOf(value).split("-|" + Constants.SPLIT)) {
                parts.add(part.trim());
            }
        }
        if (parts.size() == 2 && StringUtils.isNumeric(parts.get(0)) && StringUtils.isNumeric(parts.get(1))) {
            return new WordCountRange(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1)));
        }
        log.warn("Unparseable word count range, using template range. value={}, fallback={}", value, fallback);
        return fallback;
    }

    private String text(StageContext context, String key) {
        if (context == null) {
            return null;
        }
        Object value = context.contextValue(key);
        return value == null ? null : StringUtils.trimToNull(String.valueOf(value));
    }

    private record BriefTemplate(List<String> sections, WordCountRange wordCountRange, ToneTypeEnum tone) {
    }
}
