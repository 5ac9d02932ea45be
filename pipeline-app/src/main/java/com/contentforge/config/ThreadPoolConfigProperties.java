package com.contentforge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Run worker pool settings, prefix {@code thread.pool.executor.config}.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** Core threads, default 4 */
    private Integer corePoolSize = 4;

    /** Max threads, default 16 */
    private Integer maxPoolSize = 16;

    /** Idle thread keep-alive in seconds, default 60 */
    private Long keepAliveTime = 60L;

    /** Queue capacity for submitted runs, default 200 */
    private Integer blockQueueSize = 200;

    /**
     * Rejection policy: AbortPolicy (default), DiscardPolicy, DiscardOldestPolicy or CallerRunsPolicy.
     * Discarding policies silently drop runs whose jobs then stay PENDING until they expire.
     */
    private String policy = "AbortPolicy";

}
