package com.fraud.analytics.detector;

import java.util.List;

public class UnknownDetectorTypeException extends DetectorException {

    private final String requestedType;
    private final List<String> availableTypes;

    public UnknownDetectorTypeException(String requestedType, List<String> availableTypes) {
        super(String.format("Unknown detector type '%s'. Available types: %s", requestedType, availableTypes));
        this.requestedType = requestedType;
        this.availableTypes = List.copyOf(availableTypes);
    }

    public String getRequestedType() { return requestedType; }
    public List<String> getAvailableTypes() { return availableTypes; }
}
