package com.contentforge.infrastructure.producer;

import com.contentforge.domain.content.model.valobj.DraftContent;
import com.contentforge.domain.content.model.valobj.VoiceCheckResult;
import com.contentforge.domain.execution.adapter.gateway.IVoiceCheckProducer;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.types.common.Constants;
import com.contentforge.types.enums.ToneTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Brand voice scorer based on vocabulary lists, sentence length, tone keywords and a passive
 * voice heuristic. The overall score is the mean of the four check scores.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Component
public class KeywordVoiceCheckProducer implements IVoiceCheckProducer {

    private static final List<String> PREFERRED_TERMS = List.of("customer", "solution", "innovative",
            "data-driven", "streamline");
    private static final List<String> AVOIDED_TERMS = List.of("cheap", "easy", "best", "revolutionary",
            "game-changing");

    private static final double RECOMMENDED_SENTENCE_WORDS = 15D;
    private static final int LONG_SENTENCE_WORDS = 30;
    private static final double PASSIVE_THRESHOLD_PERCENT = 15D;

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern PASSIVE = Pattern.compile("\\b(is|are|was|were|been|be)\\s+\\w+ed\\b",
            Pattern.CASE_INSENSITIVE);

    private final Map<ToneTypeEnum, List<String>> toneKeywords = new EnumMap<>(ToneTypeEnum.class);

    public KeywordVoiceCheckProducer() {
        toneKeywords.put(ToneTypeEnum.PROFESSIONAL, List.of("implement", "strategy", "optimize", "analyze", "framework"));
        toneKeywords.put(ToneTypeEnum.CONVERSATIONAL, List.of("you", "we", "let's", "simply", "just"));
        toneKeywords.put(ToneTypeEnum.TECHNICAL, List.of("algorithm", "architecture", "protocol", "implementation", "system"));
        toneKeywords.put(ToneTypeEnum.EDUCATIONAL, List.of("learn", "understand", "example", "step", "guide"));
        toneKeywords.put(ToneTypeEnum.PERSUASIVE, List.of("proven", "results", "transform", "success", "effective"));
        toneKeywords.put(ToneTypeEnum.INSPIRATIONAL, List.of("achieve", "potential", "vision", "innovate", "empower"));
    }

    @Override
    public VoiceCheckResult invoke(DraftContent input, StageContext context) {
        String content = StringUtils.defaultString(input.content());
        ToneTypeEnum targetTone = context == null ? null : context.targetTone();
        List<String> sentences = sentences(content);

        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();
        double[] scores = {
                vocabulary(content, issues, suggestions),
                sentenceLength(sentences, issues, suggestions),
                toneAlignment(content, targetTone, suggestions),
                passiveVoice(sentences, issues, suggestions)
        };
        double score = Arrays.stream(scores).average().orElse(0D);
        boolean passed = score >= Constants.VOICE_SCORE_THRESHOLD && issues.isEmpty();
        log.debug("Voice check scored. contentType={}, tone={}, score={}, passed={}, issues={}",
                input.contentType() == null ? null : input.contentType().getCode(),
                targetTone == null ? null : targetTone.getCode(), score, passed, issues.size());
        return new VoiceCheckResult(passed, score, issues, suggestions);
    }

    private double vocabulary(String content, List<String> issues, List<String> suggestions) {
        String lower = content.toLowerCase(Locale.ROOT);
        int avoided = 0;
        for (String term : AVOIDED_TERMS) {
            if (lower.contains(term)) {
                avoided++;
                issues.add("Avoid using '" + term + "'");
                suggestions.add("Use brand-preferred terminology instead of '" + term + "'");
            }
        }
        long preferred = PREFERRED_TERMS.stream().filter(lower::contains).count();
        long total = avoided + preferred;
        return 1D - (double) avoided / Math.max(total, 1L);
    }

    private double sentenceLength(List<String> sentences, List<String> issues, List<String> suggestions) {
        if (sentences.isEmpty()) {
            return 1D;
        }
        int totalWords = 0;
        int longSentences = 0;
        for (String sentence : sentences) {
            int words = sentence.split("\\s+").length;
            totalWords += words;
            if (words > LONG_SENTENCE_WORDS) {
                longSentences++;
            }
        }
        double average = (double) totalWords / sentences.size();
        if (average > RECOMMENDED_SENTENCE_WORDS * 1.5D) {
            suggestions.add(String.format(Locale.ROOT, "Average sentence length (%.1f words) is high. Aim for %d words.",
                    average, (int) RECOMMENDED_SENTENCE_WORDS));
        }
        if (longSentences > 0) {
            issues.add(longSentences + " sentence(s) exceed " + LONG_SENTENCE_WORDS + " words");
            suggestions.add("Break long sentences into shorter ones");
        }
        return clamp(1D - (average - RECOMMENDED_SENTENCE_WORDS) / 20D);
    }

    private double toneAlignment(String content, ToneTypeEnum targetTone, List<String> suggestions) {
        if (targetTone == null) {
            return 1D;
        }
        List<String> keywords = toneKeywords.getOrDefault(targetTone, List.of());
        if (keywords.isEmpty()) {
            return 1D;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        long matches = keywords.stream().filter(lower::contains).count();
        double score = Math.min(1D, matches / Math.max(keywords.size() * 0.3D, 1D));
        if (score < 0.5D) {
            suggestions.add("Content may not match " + targetTone.getCode() + " tone. Consider incorporating: "
                    + String.join(", ", keywords.subList(0, Math.min(3, keywords.size()))));
        }
        return score;
    }

    private double passiveVoice(List<String> sentences, List<String> issues, List<String> suggestions) {
        if (sentences.isEmpty()) {
            return 1D;
        }
        long passive = sentences.stream().filter(sentence -> PASSIVE.matcher(sentence).find()).count();
        double percentage = passive * 100D / sentences.size();
        if (percentage > PASSIVE_THRESHOLD_PERCENT) {
            issues.add(String.format(Locale.ROOT, "Passive voice usage (%.1f%%) exceeds %.0f%%",
                    percentage, PASSIVE_THRESHOLD_PERCENT));
            suggestions.add("Prefer active voice");
        }
        return clamp(1D - percentage / 100D);
    }

    private List<String> sentences(String content) {
        List<String> sentences = new ArrayList<>();
        for (String part : SENTENCE_END.split(content)) {
            String sentence = part.trim();
            if (!sentence.isEmpty()) {
                sentences.add(sentence);
            }
        }
        return sentences;
    }

    private double clamp(double value) {
        return Math.max(0D, Math.min(1D, value));
    }
}
