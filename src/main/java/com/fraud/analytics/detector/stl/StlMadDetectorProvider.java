package com.fraud.analytics.detector.stl;

import com.fraud.analytics.config.DetectionConfig;
import com.fraud.analytics.detector.AnomalyDetector;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorProvider;
import com.fraud.analytics.detector.DetectorType;
import org.springframework.stereotype.Component;

@Component
public class StlMadDetectorProvider implements DetectorProvider {

    private final DetectionConfig config;

    public StlMadDetectorProvider(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedType() {
        return DetectorType.STL_MAD;
    }

    @Override
    public AnomalyDetector create(DetectorParams params) {
        return new StlMadDetector(config.withDefaults(params), config.getDefaults().getStlPeriod());
    }
}
