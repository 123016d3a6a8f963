package com.fraud.cohortanomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools and the clock used by detection runs. Workers process cohorts;
 * the fetch pool runs data-source calls so they can be abandoned on timeout.
 */
@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "detectionWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService detectionWorkerPool(DetectionConfig config) {
        return Executors.newFixedThreadPool(
                Math.max(1, config.getJob().getWorkerPoolSize()), daemonThreads("detection-worker"));
    }

    @Bean(name = "dataSourceFetchPool", destroyMethod = "shutdownNow")
    public ExecutorService dataSourceFetchPool(DetectionConfig config) {
        // One fetch in flight per worker plus the cohort listing
        return Executors.newFixedThreadPool(
                Math.max(2, config.getJob().getWorkerPoolSize() + 1), daemonThreads("datasource-fetch"));
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
