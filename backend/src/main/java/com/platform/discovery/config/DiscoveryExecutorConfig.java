package com.platform.discovery.config;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Background worker and CSV mapper used by discovery runs.
 */
@Configuration
public class DiscoveryExecutorConfig {

    /**
     * Runs are polled one at a time on a single named worker thread.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService discoveryExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "discovery-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public CsvMapper csvMapper() {
        return new CsvMapper();
    }
}
