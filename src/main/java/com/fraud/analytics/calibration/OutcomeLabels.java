package com.fraud.analytics.calibration;

import java.util.Locale;

final class OutcomeLabels {

    private OutcomeLabels() {}

    /**
     * Binarise an outcome label: 1.0 for fraud, 0.0 for not fraud, null when unrecognised.
     */
    static Double binarize(Object outcome) {
        if (outcome == null) return null;
        if (outcome instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        if (outcome instanceof Number number) {
            double value = number.doubleValue();
            if (value == 1.0) return 1.0;
            if (value == 0.0) return 0.0;
            return null;
        }
        return switch (outcome.toString().trim().toUpperCase(Locale.ROOT)) {
            case "FRAUD", "1", "TRUE" -> 1.0;
            case "NOT_FRAUD", "0", "FALSE" -> 0.0;
            default -> null;
        };
    }
}
