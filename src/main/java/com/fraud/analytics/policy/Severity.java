package com.fraud.analytics.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    INFO,
    WARN,
    CRITICAL;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse; "warning" is accepted for WARN. Returns null for unknown labels.
     */
    @JsonCreator
    public static Severity fromLabel(String label) {
        if (label == null) return null;
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) return WARN;
        for (Severity severity : values()) {
            if (severity.name().equals(normalized)) return severity;
        }
        return null;
    }
}
