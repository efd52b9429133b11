package com.fraud.analytics.detector;

/**
 * Builds configured detectors of one type. Every implementation registered as a bean is picked
 * up by {@link DetectorFactory} at startup.
 */
public interface DetectorProvider {

    /**
     * The detector type this provider builds.
     */
    DetectorType getSupportedType();

    AnomalyDetector create(DetectorParams params);
}
