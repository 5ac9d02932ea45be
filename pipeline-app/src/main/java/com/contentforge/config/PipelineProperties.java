package com.contentforge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Engine settings, prefix {@code pipeline}.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Executor executor = new Executor();

    private Plan plan = new Plan();

    private Job job = new Job();

    @Data
    public static class Executor {

        /**
         * Promote quality gate failures to run-ending errors. Lenient by default; under product review.
         */
        private boolean strictQualityGates = false;

        /** Dispatch the tracks of a parallel fan-out step concurrently */
        private boolean parallelFanOut = true;

        /** Format requested when the request context names none */
        private String defaultOutputFormat = "html";
    }

    @Data
    public static class Plan {

        /**
         * Step sequence overrides keyed by workflow shape code, e.g.
         * {@code presentation: [research, brief, draft, voice-check, format]}
         */
        private Map<String, List<String>> workflows = new LinkedHashMap<>();
    }

    @Data
    public static class Job {

        /** Hours a job stays pollable after its last update */
        private long ttlHours = 24L;

        /** Upper bound on tracked jobs; the least recently written are evicted first */
        private long maximumSize = 10_000L;
    }
}
