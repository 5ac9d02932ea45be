package com.contentforge.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools.
 * <ul>
 *   <li>{@code pipelineRunWorker}: drives submitted runs, one task per run</li>
 *   <li>{@code pipelineTrackWorker}: concurrent fan-out tracks within a step</li>
 * </ul>
 * Tracks never run on the run pool.
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "pipelineRunWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "pipelineRunWorker")
    public ThreadPoolExecutor pipelineRunWorker(ThreadPoolConfigProperties properties) {
        int coreSize = Math.max(properties.getCorePoolSize(), 1);
        return new ThreadPoolExecutor(
                coreSize,
                Math.max(properties.getMaxPoolSize(), coreSize),
                Math.max(properties.getKeepAliveTime(), 0L),
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(Math.max(properties.getBlockQueueSize(), 1)),
                namedThreadFactory("pipeline-run-worker-"),
                buildRejectedExecutionHandler(properties.getPolicy()));
    }

    /**
     * Default queue-capacity=0 with CallerRunsPolicy: a track that finds no free thread runs on the
     * run's own thread instead of waiting in a queue.
     */
    @Bean(name = "pipelineTrackWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "pipelineTrackWorker")
    public ThreadPoolExecutor pipelineTrackWorker(
            @Value("${executor.track-worker.core-size:4}") int coreSize,
            @Value("${executor.track-worker.max-size:8}") int maxSize,
            @Value("${executor.track-worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.track-worker.queue-capacity:0}") int queueCapacity,
            @Value("${executor.track-worker.rejection-policy:CallerRunsPolicy}") String rejectionPolicy,
            @Value("${executor.track-worker.thread-name-prefix:pipeline-track-worker-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                Math.max(keepAliveSeconds, 0L),
                TimeUnit.SECONDS,
                queue,
                namedThreadFactory(threadNamePrefix),
                buildTrackRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(false);
        return executor;
    }

    /**
     * A discarded track never completes and its run would wait on it forever, so only
     * CallerRunsPolicy and AbortPolicy are accepted for the track pool.
     */
    private RejectedExecutionHandler buildTrackRejectedExecutionHandler(String policy) {
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        if (!"CallerRunsPolicy".equals(policy)) {
            log.warn("Rejection policy '{}' is not allowed for the track pool, fallback to CallerRunsPolicy", policy);
        }
        return new ThreadPoolExecutor.CallerRunsPolicy();
    }

    private ThreadFactory namedThreadFactory(String threadNamePrefix) {
        AtomicInteger threadIndex = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
