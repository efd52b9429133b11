package com.fraud.analytics.detector;

public class EmptySeriesException extends InsufficientDataException {

    public EmptySeriesException(int minSupport) {
        super("Series is empty", 0, minSupport);
    }
}
