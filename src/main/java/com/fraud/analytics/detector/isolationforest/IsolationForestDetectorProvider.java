package com.fraud.analytics.detector.isolationforest;

import com.fraud.analytics.config.DetectionConfig;
import com.fraud.analytics.detector.AnomalyDetector;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorProvider;
import com.fraud.analytics.detector.DetectorType;
import org.springframework.stereotype.Component;

@Component
public class IsolationForestDetectorProvider implements DetectorProvider {

    private final DetectionConfig config;

    public IsolationForestDetectorProvider(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.ISOFOREST;
    }

    @Override
    public AnomalyDetector create(DetectorParams params) {
        return new IsolationForestDetector(config.withDefaults(params));
    }
}
