package com.fraud.analytics.detector;

/**
 * A NaN or infinite value reached a detector. Signals an upstream data-quality defect.
 */
public class NonFiniteInputException extends DetectorException {

    private final int index;
    private final String metric;

    public NonFiniteInputException(int index, String metric, double value) {
        super(String.format("Non-finite value %s for metric '%s' at index %d", value, metric, index));
        this.index = index;
        this.metric = metric;
    }

    public int getIndex() { return index; }
    public String getMetric() { return metric; }
}
