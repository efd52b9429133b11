package com.fraud.analytics.series;

public class SeriesFetchException extends RuntimeException {

    public SeriesFetchException(String message) {
        super(message);
    }

    public SeriesFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
