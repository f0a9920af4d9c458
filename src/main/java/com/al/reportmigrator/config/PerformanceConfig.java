package com.al.reportmigrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Shared worker pool for batch conversions.
 */
@Configuration
public class PerformanceConfig {

    @Value("${report-migrator.batch.threads:0}")
    private int batchThreads;

    /**
     * Fixed pool sized to the configured thread count, or to the number of
     * processors (at least 4) when unset.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService batchExecutor() {
        int size = batchThreads > 0 ? batchThreads : Math.max(4, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(size);
    }
}
