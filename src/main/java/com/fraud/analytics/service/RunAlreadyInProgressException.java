package com.fraud.analytics.service;

import java.time.Instant;

public class RunAlreadyInProgressException extends RuntimeException {

    public RunAlreadyInProgressException(String detectorId, Instant windowFrom, Instant windowTo) {
        super(String.format("A run for detector %s over [%s, %s) is already in progress",
                detectorId, windowFrom, windowTo));
    }
}
