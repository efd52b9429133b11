package com.fraud.analytics.policy;

import com.fraud.analytics.config.DetectionConfig;
import org.springframework.stereotype.Component;

/**
 * Derives an event severity from a detector score relative to that detector's k:
 * critical at or above {@code criticalScoreMultiplier × k}, warn above k, info otherwise.
 */
@Component
public class SeverityClassifier {

    private final DetectionConfig config;

    public SeverityClassifier(DetectionConfig config) {
        this.config = config;
    }

    public Severity classify(double score, double k) {
        if (score >= config.getCriticalScoreMultiplier() * k) {
            return Severity.CRITICAL;
        }
        if (score > k) {
            return Severity.WARN;
        }
        return Severity.INFO;
    }
}
