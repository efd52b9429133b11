package com.fraud.analytics.detector;

/**
 * Base type for failures raised by detectors and the detector factory.
 */
public class DetectorException extends RuntimeException {

    public DetectorException(String message) {
        super(message);
    }
}
