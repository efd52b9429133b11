package com.fraud.analytics.detector;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only view over a detector's string parameter map.
 * Missing or malformed values fall back to the supplied default, so omission never raises.
 */
public final class DetectorParams {

    public static final String K = "k";
    public static final String PERSISTENCE = "persistence";
    public static final String MIN_SUPPORT = "min_support";

    public static final double DEFAULT_K = 3.5;
    public static final int DEFAULT_PERSISTENCE = 2;
    public static final int DEFAULT_MIN_SUPPORT = 50;

    private static final DetectorParams EMPTY = new DetectorParams(Collections.emptyMap());

    private final Map<String, String> values;

    private DetectorParams(Map<String, String> values) {
        this.values = values;
    }

    public static DetectorParams of(Map<String, String> values) {
        if (values == null || values.isEmpty()) return EMPTY;
        return new DetectorParams(Collections.unmodifiableMap(new HashMap<>(values)));
    }

    public static DetectorParams empty() {
        return EMPTY;
    }

    public boolean contains(String key) {
        String val = values.get(key);
        return val != null && !val.isBlank();
    }

    public String getString(String key, String defaultValue) {
        String val = values.get(key);
        return val == null || val.isBlank() ? defaultValue : val.trim();
    }

    public double getDouble(String key, double defaultValue) {
        String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            double parsed = Double.parseDouble(val.trim());
            return Double.isFinite(parsed) ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public int getInt(String key, int defaultValue) {
        String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            // accept "2.0" style values written by numeric JSON config
            double asDouble = getDouble(key, Double.NaN);
            return Double.isNaN(asDouble) ? defaultValue : (int) asDouble;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = values.get(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = values.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        return Boolean.parseBoolean(val.trim());
    }

    public double k() {
        return getDouble(K, DEFAULT_K);
    }

    public int persistence() {
        return getInt(PERSISTENCE, DEFAULT_PERSISTENCE);
    }

    public int minSupport() {
        return getInt(MIN_SUPPORT, DEFAULT_MIN_SUPPORT);
    }

    public Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "DetectorParams" + values;
    }
}
