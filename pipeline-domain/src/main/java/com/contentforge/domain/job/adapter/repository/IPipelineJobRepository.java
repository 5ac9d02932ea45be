package com.contentforge.domain.job.adapter.repository;

import com.contentforge.domain.job.model.entity.PipelineJobEntity;

/**
 * Job store: one entry per run id, dropped once its time-to-live has passed since the last write.
 *
 * @author contentforge
 * @since 2025-03-02
 */
public interface IPipelineJobRepository {

    /**
     * Create an entry on submit.
     *
     * @throws IllegalStateException if the run id is already tracked
     */
    PipelineJobEntity save(PipelineJobEntity entity);

    /**
     * Replace the entry of a tracked run and restart its time-to-live.
     */
    PipelineJobEntity update(PipelineJobEntity entity);

    /**
     * @return a copy of the entry, or null if unknown or expired
     */
    PipelineJobEntity findByRunId(String runId);

    boolean remove(String runId);

    /**
     * Drop expired entries.
     *
     * @return number of entries still tracked
     */
    long purgeExpired();

    long size();
}
