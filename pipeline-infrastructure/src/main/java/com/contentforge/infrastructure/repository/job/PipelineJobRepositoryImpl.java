package com.contentforge.infrastructure.repository.job;

import com.contentforge.domain.job.adapter.repository.IPipelineJobRepository;
import com.contentforge.domain.job.model.entity.PipelineJobEntity;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store on a Guava cache; the cache's expire-after-write setting is the job TTL.
 * <p>
 * Entries are stored and handed out as copies, so a poller never observes a half-written job.
 * </p>
 *
 * @author contentforge
 * @since 2025-03-02
 */
@Slf4j
@Repository
public class PipelineJobRepositoryImpl implements IPipelineJobRepository {

    private final Cache<String, PipelineJobEntity> jobCache;

    public PipelineJobRepositoryImpl(@Qualifier("pipelineJobCache") Cache<String, PipelineJobEntity> jobCache) {
        this.jobCache = jobCache;
    }

    @Override
    public PipelineJobEntity save(PipelineJobEntity entity) {
        requireRunId(entity);
        PipelineJobEntity previous = jobCache.asMap().putIfAbsent(entity.getRunId(), entity.copy());
        if (previous != null) {
            throw new IllegalStateException("Job already tracked: " + entity.getRunId());
        }
        return entity;
    }

    /**
     * Also re-inserts an entry that expired while its run was still writing to it.
     */
    @Override
    public PipelineJobEntity update(PipelineJobEntity entity) {
        requireRunId(entity);
        PipelineJobEntity previous = jobCache.asMap().put(entity.getRunId(), entity.copy());
        if (previous == null) {
            log.warn("Job entry re-created on update. runId={}, status={}", entity.getRunId(), entity.getStatus());
        }
        return entity;
    }

    @Override
    public PipelineJobEntity findByRunId(String runId) {
        if (StringUtils.isBlank(runId)) {
            return null;
        }
        PipelineJobEntity entity = jobCache.getIfPresent(runId);
        return entity == null ? null : entity.copy();
    }

    @Override
    public boolean remove(String runId) {
        if (StringUtils.isBlank(runId)) {
            return false;
        }
        return jobCache.asMap().remove(runId) != null;
    }

    @Override
    public long purgeExpired() {
        jobCache.cleanUp();
        return jobCache.size();
    }

    @Override
    public long size() {
        return jobCache.size();
    }

    private void requireRunId(PipelineJobEntity entity) {
        if (entity == null || StringUtils.isBlank(entity.getRunId())) {
            throw new IllegalArgumentException("Job run id cannot be blank");
        }
    }
}
