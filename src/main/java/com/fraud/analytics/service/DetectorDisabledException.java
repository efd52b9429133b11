package com.fraud.analytics.service;

public class DetectorDisabledException extends RuntimeException {

    public DetectorDisabledException(String detectorId) {
        super("Detector is disabled: " + detectorId);
    }
}
