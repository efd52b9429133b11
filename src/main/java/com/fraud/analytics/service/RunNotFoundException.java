package com.fraud.analytics.service;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String runId) {
        super("Detection run not found: " + runId);
    }
}
