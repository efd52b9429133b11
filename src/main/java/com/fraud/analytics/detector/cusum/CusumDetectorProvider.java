package com.fraud.analytics.detector.cusum;

import com.fraud.analytics.config.DetectionConfig;
import com.fraud.analytics.detector.AnomalyDetector;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorProvider;
import com.fraud.analytics.detector.DetectorType;
import org.springframework.stereotype.Component;

@Component
public class CusumDetectorProvider implements DetectorProvider {

    private final DetectionConfig config;

    public CusumDetectorProvider(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.CUSUM;
    }

    @Override
    public AnomalyDetector create(DetectorParams params) {
        return new CusumDetector(config.withDefaults(params));
    }
}
