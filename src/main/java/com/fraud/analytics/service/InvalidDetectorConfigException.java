package com.fraud.analytics.service;

/**
 * A stored detector config that cannot be run, such as one without a primary metric.
 */
public class InvalidDetectorConfigException extends RuntimeException {

    public InvalidDetectorConfigException(String detectorId, String problem) {
        super("Detector " + detectorId + " is misconfigured: " + problem);
    }
}
