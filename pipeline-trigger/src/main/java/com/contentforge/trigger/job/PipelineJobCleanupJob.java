package com.contentforge.trigger.job;

import com.contentforge.domain.job.adapter.repository.IPipelineJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drops job entries whose TTL has passed.
 */
@Slf4j
@Component
public class PipelineJobCleanupJob {

    private final IPipelineJobRepository pipelineJobRepository;

    public PipelineJobCleanupJob(IPipelineJobRepository pipelineJobRepository) {
        this.pipelineJobRepository = pipelineJobRepository;
    }

    @Scheduled(fixedDelayString = "${pipeline-job.cleanup-interval-ms:60000}", scheduler = "daemonScheduler")
    public void purgeExpiredJobs() {
        long before = pipelineJobRepository.size();
        long remaining = pipelineJobRepository.purgeExpired();
        if (remaining < before) {
            log.info("Expired pipeline jobs purged. purged={}, remaining={}", before - remaining, remaining);
        } else {
            log.debug("Pipeline job cleanup found nothing to purge. tracked={}", remaining);
        }
    }
}
