package com.example.pdfhandler.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Typed view of the {@code pdfhandler.*} settings in {@code application.properties}.
 */
@ConfigurationProperties(prefix = "pdfhandler")
public record PdfHandlerProperties(Batch batch, Merge merge) {

    public PdfHandlerProperties {
        batch = batch != null ? batch : new Batch(null, 0, null);
        merge = merge != null ? merge : new Merge(null);
    }

    /**
     * Worker settings. Batches always run on a single worker thread.
     *
     * @param threadNamePrefix name prefix of the worker thread
     * @param queueCapacity    batches that may wait for the worker before submissions are rejected
     * @param retention        how long a finished job stays queryable before it is evicted
     */
    public record Batch(String threadNamePrefix, int queueCapacity, Duration retention) {

        public Batch {
            threadNamePrefix = threadNamePrefix != null && !threadNamePrefix.isBlank() ? threadNamePrefix : "pdf-batch-";
            queueCapacity = queueCapacity > 0 ? queueCapacity : 32;
            retention = retention != null && !retention.isNegative() ? retention : Duration.ofHours(1);
        }
    }

    /**
     * @param defaultFileName merged file name used when the caller gives none
     */
    public record Merge(String defaultFileName) {

        public Merge {
            defaultFileName = defaultFileName != null && !defaultFileName.isBlank() ? defaultFileName : "merged.pdf";
        }
    }
}
