package com.finrisk.analytics.config;

import com.finrisk.analytics.anomaly.AnomalySettings;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

    static final int DETECTION_QUEUE_CAPACITY = 30;

    @Bean
    public AnomalySettings anomalySettings(FinRiskProperties properties) {
        return properties.anomaly().toSettings();
    }

    /**
     * Shared pool for the per-category detection tasks of a parallel report run.
     * Spring initializes it and drains it on context shutdown.
     */
    @Bean("anomalyDetectionExecutor")
    public ThreadPoolTaskExecutor anomalyDetectionExecutor(FinRiskProperties properties) {
        int threads = properties.anomaly().workerThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(DETECTION_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("anomaly-detect-");
        // fail fast when the queue is full; the caller gets the rejection
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy() {
            @Override
            public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                log.warn("anomaly_executor rejected task active={} poolSize={} queueSize={}",
                        e.getActiveCount(), e.getPoolSize(), e.getQueue().size());
                super.rejectedExecution(r, e);
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        log.info("anomaly_executor configured threads={} queueCapacity={}", threads, DETECTION_QUEUE_CAPACITY);
        return executor;
    }
}
