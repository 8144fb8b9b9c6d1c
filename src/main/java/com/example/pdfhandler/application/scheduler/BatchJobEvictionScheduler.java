package com.example.pdfhandler.application.scheduler;

import com.example.pdfhandler.application.service.BatchJobService;
import com.example.pdfhandler.infrastructure.config.PdfHandlerProperties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodically removes finished batch jobs once their retention period has passed,
 * so the job registry does not grow for the life of the process.
 */
@Component
public class BatchJobEvictionScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchJobEvictionScheduler.class);

    private final BatchJobService batchJobService;
    private final Duration retention;

    public BatchJobEvictionScheduler(BatchJobService batchJobService, PdfHandlerProperties properties) {
        this.batchJobService = batchJobService;
        this.retention = properties.batch().retention();
    }

    /**
     * Evicts jobs that finished more than {@code pdfhandler.batch.retention} ago.
     */
    @Scheduled(fixedDelayString = "${pdfhandler.batch.eviction-interval:PT5M}")
    public void evictExpiredJobs() {
        int evicted = batchJobService.evictFinishedBefore(Instant.now().minus(retention));
        if (evicted > 0) {
            log.info("Evicted {} finished batch job(s) older than {}", evicted, retention);
        }
    }
}
