package com.fraud.analytics.detector;

/**
 * The series is shorter than the detector's min_support.
 * Structural: the window genuinely lacks data, so the run is not retried.
 */
public class InsufficientDataException extends DetectorException {

    private final int length;
    private final int minSupport;

    public InsufficientDataException(int length, int minSupport) {
        this(String.format("Series has %d points, detector requires min_support=%d", length, minSupport),
                length, minSupport);
    }

    protected InsufficientDataException(String message, int length, int minSupport) {
        super(message);
        this.length = length;
        this.minSupport = minSupport;
    }

    public int getLength() { return length; }
    public int getMinSupport() { return minSupport; }
}
