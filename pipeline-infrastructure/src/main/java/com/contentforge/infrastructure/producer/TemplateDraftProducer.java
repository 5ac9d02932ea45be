package com.contentforge.infrastructure.producer;

import com.contentforge.domain.content.model.valobj.ContentBrief;
import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.WordCountRange;
import com.contentforge.domain.execution.adapter.gateway.IDraftProducer;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.types.enums.ToneTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Draft producer assembling markdown from the brief: a title, one section per required section,
 * and sentences built from the key messages until the word count reaches the lower quarter of
 * the brief's range.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Component
public class TemplateDraftProducer implements IDraftProducer {

    private static final WordCountRange DEFAULT_RANGE = new WordCountRange(300, 800);

    private static final List<String> FILLERS = List.of("Start small today.", "Act now.", "Begin.");

    private final Map<ToneTypeEnum, String> toneSentences = new EnumMap<>(ToneTypeEnum.class);

    public TemplateDraftProducer() {
        toneSentences.put(ToneTypeEnum.PROFESSIONAL,
                "Leaders who implement a clear strategy can analyze progress and optimize delivery within one framework.");
        toneSentences.put(ToneTypeEnum.CONVERSATIONAL,
                "Here we share what you need to know, so let's walk through it and simply start small.");
        toneSentences.put(ToneTypeEnum.TECHNICAL,
                "The system architecture defines each protocol, and the implementation follows a proven algorithm.");
        toneSentences.put(ToneTypeEnum.EDUCATIONAL,
                "This guide helps you learn each step, understand the core ideas and apply every example.");
        toneSentences.put(ToneTypeEnum.PERSUASIVE,
                "Proven results show how an effective approach can transform teams and drive success.");
        toneSentences.put(ToneTypeEnum.INSPIRATIONAL,
                "Teams that share a vision achieve their potential, innovate faster and empower every contributor.");
    }

    @Override
    public DraftContent invoke(ContentBrief input, StageContext context) {
        String topic = context == null ? null : context.topic();
        String title = StringUtils.defaultIfBlank(topic, "Untitled").trim();
        WordCountRange range = input.wordCountRange() != null && input.wordCountRange().isWellFormed()
                ? input.wordCountRange()
                : DEFAULT_RANGE;
        int target = range.min() + (range.max() - range.min()) / 4;

        List<String> sentences = sentencePool(input, title);
        List<String> sections = input.requiredSections().isEmpty() ? List.of("Overview") : input.requiredSections();
        List<StringBuilder> bodies = new ArrayList<>();
        int words = countWords("# " + title);
        for (String section : sections) {
            bodies.add(new StringBuilder());
            words += countWords("## " + section);
        }

        int index = 0;
        int placed = 0;
        int skipped = 0;
        while (words < target && skipped < sentences.size()) {
            String sentence = sentences.get(index++ % sentences.size());
            int sentenceWords = countWords(sentence);
            if (words + sentenceWords > range.max()) {
                skipped++;
                continue;
            }
            skipped = 0;
            append(bodies.get(placed++ % bodies.size()), sentence);
            words += sentenceWords;
        }
        // narrow ranges: close the gap to the minimum without passing the maximum
        for (String filler : FILLERS) {
            int fillerWords = countWords(filler);
            while (words < range.min() && words + fillerWords <= range.max()) {
                append(bodies.get(placed++ % bodies.size()), filler);
                words += fillerWords;
            }
        }

        StringBuilder content = new StringBuilder("# ").append(title).append("\n\n");
        for (int i = 0; i < sections.size(); i++) {
            content.append("## ").append(sections.get(i)).append("\n\n").append(bodies.get(i)).append("\n\n");
        }
        String text = content.toString().trim();
        int wordCount = countWords(text);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", title);
        metadata.put("sections", sections.size());
        metadata.put("tone", input.tone() == null ? null : input.tone().getCode());
        metadata.put("seo_keywords", input.seoKeywords());
        log.debug("Draft assembled. contentType={}, words={}, range={}",
                input.contentType() == null ? null : input.contentType().getCode(), wordCount, range);
        return new DraftContent(text, input.contentType(), wordCount, metadata, input, DraftContent.DEFAULT_FORMAT);
    }

    private List<String> sentencePool(ContentBrief brief, String title) {
        List<String> pool = new ArrayList<>();
        ToneTypeEnum tone = brief.tone() == null ? ToneTypeEnum.PROFESSIONAL : brief.tone();
        pool.add(toneSentences.get(tone));
        for (String message : brief.keyMessages()) {
            pool.add(StringUtils.endsWithAny(message, ".", "!", "?") ? message : message + ".");
        }
        pool.add("For " + StringUtils.uncapitalize(StringUtils.defaultIfBlank(brief.targetAudience(), "readers"))
                + ", the practical question around " + title + " comes down to where to start.");
        pool.add("A small pilot with clear goals gives every team a fair view of the impact.");
        pool.add("Regular reviews keep the work focused on outcomes that matter to customers.");
        return pool;
    }

    private void append(StringBuilder body, String sentence) {
        if (body.length() > 0) {
            body.append(' ');
        }
        body.append(sentence);
    }

    static int countWords(String text) {
        String trimmed = StringUtils.trimToEmpty(text);
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
