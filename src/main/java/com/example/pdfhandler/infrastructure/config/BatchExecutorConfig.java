package com.example.pdfhandler.infrastructure.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the dedicated worker that runs merge and split batches off the caller's thread.
 * A single thread keeps batches serial; PDF documents are never mutated concurrently.
 */
@Configuration
@EnableConfigurationProperties(PdfHandlerProperties.class)
public class BatchExecutorConfig {

    public static final String BATCH_EXECUTOR = "pdfBatchExecutor";

    /**
     * Creates the single-threaded batch executor. Prefix and queue size come from
     * {@code pdfhandler.batch.*}.
     *
     * @param properties bound application settings
     * @return executor used by the batch job service
     */
    @Bean(name = BATCH_EXECUTOR, destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor pdfBatchExecutor(PdfHandlerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.batch().queueCapacity());
        executor.setThreadNamePrefix(properties.batch().threadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
