package com.contentforge.config;

import com.contentforge.domain.job.model.entity.PipelineJobEntity;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava cache configuration.
 * <p>
 * The job cache expires entries {@code pipeline.job.ttl-hours} after their last write.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "pipelineJobCache")
    public Cache<String, PipelineJobEntity> pipelineJobCache(PipelineProperties properties) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(properties.getJob().getTtlHours(), 1L), TimeUnit.HOURS)
                .maximumSize(Math.max(properties.getJob().getMaximumSize(), 1L))
                .build();
    }

}
