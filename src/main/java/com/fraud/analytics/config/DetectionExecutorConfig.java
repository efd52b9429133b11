package com.fraud.analytics.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class DetectionExecutorConfig {

    public static final String DETECTION_EXECUTOR = "detectionExecutor";
    public static final String ALERT_EXECUTOR = "alertExecutor";

    /**
     * Bounded pool for detection runs. A full queue rejects the submission instead of
     * growing without limit; the orchestrator turns that into a failed run.
     */
    @Bean(name = DETECTION_EXECUTOR)
    public ThreadPoolTaskExecutor detectionExecutor(DetectionConfig config) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize());
        executor.setMaxPoolSize(config.getWorkerPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("detection-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(config.getShutdownAwaitSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Investigator alerts run apart from detection so a slow or saturated alert path never
     * holds a detection worker.
     */
    @Bean(name = ALERT_EXECUTOR)
    public ThreadPoolTaskExecutor alertExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("alert-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }
}
