package com.fraud.analytics.service;

public class DetectorNotFoundException extends RuntimeException {

    private final String detectorId;

    public DetectorNotFoundException(String detectorId) {
        super("Detector not found: " + detectorId);
        this.detectorId = detectorId;
    }

    public String getDetectorId() {
        return detectorId;
    }
}
