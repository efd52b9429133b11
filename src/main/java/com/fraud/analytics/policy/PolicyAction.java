package com.fraud.analytics.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PolicyAction {
    INVESTIGATE,
    MONITOR,
    IGNORE;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static PolicyAction fromLabel(String label) {
        if (label == null) return null;
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (PolicyAction action : values()) {
            if (action.name().equals(normalized)) return action;
        }
        return null;
    }
}
