package com.contentforge.infrastructure.producer;

import com.contentforge.domain.content.model.valobj.ResearchBrief;
import com.contentforge.domain.content.model.valobj.Source;
import com.contentforge.domain.execution.adapter.gateway.IResearchProducer;
import com.contentforge.domain.execution.model.valobj.StageContext;
import com.contentforge.domain.planning.model.valobj.ContentRequest;
import com.contentforge.types.common.Constants;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Research producer working from a fixed source catalogue instead of a search provider.
 * Deterministic: the same topic always yields the same brief.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Component
public class TemplateResearchProducer implements IResearchProducer {

    public static final String FOCUS_AREAS_KEY = "focus_areas";

    private static final int MAX_FINDINGS = 5;
    private static final Pattern PERCENTAGE = Pattern.compile("(\\d+(?:\\.\\d+)?%)");

    @Override
    public ResearchBrief invoke(ContentRequest input, StageContext context) {
        String topic = StringUtils.defaultIfBlank(context == null ? null : context.topic(), input.requestText()).trim();
        List<Source> sources = catalogue(topic);
        List<String> findings = keyFindings(sources, topic);
        Map<String, Object> dataPoints = dataPoints(sources);
        List<String> gaps = researchGaps(sources, findings, context == null ? null : context.contextValue(FOCUS_AREAS_KEY));
        log.debug("Research assembled. topic={}, sources={}, findings={}, gaps={}",
                topic, sources.size(), findings.size(), gaps.size());
        return new ResearchBrief(topic, sources, findings, dataPoints, gaps, LocalDateTime.now());
    }

    private List<Source> catalogue(String topic) {
        String slug = slug(topic);
        String lower = topic.toLowerCase(Locale.ROOT);
        List<Source> sources = new ArrayList<>();
        sources.add(new Source("https://research.edu/" + slug + "-study",
                "Research Study: Impact of " + topic, "Academic Research Group", "2025-11-20", 0.9D,
                List.of("Teams that adopt " + lower + " gain measurable efficiency."),
                List.of("Organizations adopting " + lower + " report a 40% gain in efficiency metrics.",
                        "The study followed 500 participants across 50 organizations.")));
        sources.add(new Source("https://example.org/" + slug + "-guide",
                "A Practical Guide to " + topic, "Industry Expert", "2025-12-15", 0.8D,
                List.of("Structured rollout matters more than tooling."),
                List.of("Organizations that apply " + lower + " report outcomes 35% above their baseline.",
                        "Stakeholder engagement and ongoing monitoring drive lasting adoption.")));
        sources.add(new Source("https://tech-news.com/" + slug + "-trends",
                "Trends in " + topic, "Editorial Team", "2026-01-10", 0.65D,
                List.of(),
                List.of("Surveys show 68% of enterprises plan to invest in " + lower + " this year.")));
        sources.add(new Source("https://business-insights.com/" + slug + "-roi",
                "Business Returns of " + topic, "Business Analyst", "2025-10-05", 0.7D,
                List.of(),
                List.of("Companies recover their " + lower + " investment within 18 months on average.",
                        "Annual cost savings average 25% after a phased rollout.")));
        return sources;
    }

    private List<String> keyFindings(List<Source> sources, String topic) {
        LinkedHashSet<String> findings = new LinkedHashSet<>();
        for (Source source : sources) {
            if (source.credibilityScore() >= Constants.HIGH_CREDIBILITY_THRESHOLD && !source.keyFacts().isEmpty()) {
                findings.add(source.keyFacts().get(0));
            }
        }
        if (findings.size() < 3) {
            for (Source source : sources) {
                for (String fact : source.keyFacts()) {
                    findings.add(fact);
                    if (findings.size() >= 3) {
                        break;
                    }
                }
            }
        }
        if (findings.isEmpty() && !sources.isEmpty()) {
            findings.add("Research on " + topic + " drew on " + sources.size() + " sources");
        }
        return new ArrayList<>(findings).subList(0, Math.min(findings.size(), MAX_FINDINGS));
    }

    private Map<String, Object> dataPoints(List<Source> sources) {
        Map<String, Object> dataPoints = new LinkedHashMap<>();
        long highCredibility = sources.stream()
                .filter(source -> source.credibilityScore() >= Constants.HIGH_CREDIBILITY_THRESHOLD)
                .count();
        double average = sources.stream().mapToDouble(Source::credibilityScore).average().orElse(0D);
        Set<String> domains = new LinkedHashSet<>();
        List<String> statistics = new ArrayList<>();
        for (Source source : sources) {
            domains.add(URI.create(source.url()).getHost());
            for (String fact : source.keyFacts()) {
                Matcher matcher = PERCENTAGE.matcher(fact);
                while (matcher.find()) {
                    statistics.add(matcher.group(1));
                }
            }
        }
        dataPoints.put("source_count", sources.size());
        dataPoints.put("high_credibility_sources", highCredibility);
        dataPoints.put("average_credibility", average);
        dataPoints.put("source_domains", new ArrayList<>(domains));
        if (!statistics.isEmpty()) {
            dataPoints.put("statistics_found", statistics);
        }
        return dataPoints;
    }

    private List<String> researchGaps(List<Source> sources, List<String> findings, Object focusAreas) {
        List<String> gaps = new ArrayList<>();
        long highCredibility = sources.stream()
                .filter(source -> source.credibilityScore() >= Constants.HIGH_CREDIBILITY_THRESHOLD)
                .count();
        if (highCredibility < 2) {
            gaps.add("Need more high-credibility sources");
        }
        if (findings.size() < 3) {
            gaps.add("Need more key findings");
        }
        if (focusAreas instanceof Iterable<?> areas) {
            for (Object area : areas) {
                String text = String.valueOf(area);
                boolean covered = findings.stream()
                        .anyMatch(finding -> StringUtils.containsIgnoreCase(finding, text));
                if (!covered) {
                    gaps.add("Focus area '" + text + "' not covered by research");
                }
            }
        }
        return gaps;
    }

    static String slug(String text) {
        String slug = text.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-");
        slug = StringUtils.strip(slug, "-");
        slug = StringUtils.left(slug, 50);
        return StringUtils.defaultIfBlank(StringUtils.stripEnd(slug, "-"), "content");
    }
}
