package com.fraud.analytics.config;

import com.fraud.analytics.detector.DetectorParams;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Upper bound on a single warehouse fetch; a timeout fails the run.
    private long fetchTimeoutSeconds = 30;

    // Detection worker pool. Numerical work never runs on request threads.
    private int workerPoolSize = 4;
    private int queueCapacity = 100;

    // How long shutdown waits for in-flight runs before cancelling them.
    private int shutdownAwaitSeconds = 10;

    // score >= multiplier × k is classified critical; score > k is warn.
    private double criticalScoreMultiplier = 2.0;

    // Fallback detector parameters when a detector's params omit them.
    private Defaults defaults = new Defaults();

    @Data
    public static class Defaults {
        private double k = DetectorParams.DEFAULT_K;
        private int persistence = DetectorParams.DEFAULT_PERSISTENCE;
        private int minSupport = DetectorParams.DEFAULT_MIN_SUPPORT;
        private int stlPeriod = 672;
    }

    /**
     * Fill the common parameters a detector's params leave out with the configured defaults.
     */
    public DetectorParams withDefaults(DetectorParams params) {
        DetectorParams source = params == null ? DetectorParams.empty() : params;
        Map<String, String> merged = new HashMap<>(source.asMap());
        merged.putIfAbsent(DetectorParams.K, String.valueOf(defaults.getK()));
        merged.putIfAbsent(DetectorParams.PERSISTENCE, String.valueOf(defaults.getPersistence()));
        merged.putIfAbsent(DetectorParams.MIN_SUPPORT, String.valueOf(defaults.getMinSupport()));
        return DetectorParams.of(merged);
    }
}
