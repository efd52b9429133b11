package com.fraud.analytics.detector;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Detector algorithm families. The tag is the value stored in detector configuration.
 * RCF and MATRIX_PROFILE are recognised tags without a registered implementation.
 */
public enum DetectorType {
    STL_MAD("stl_mad"),
    CUSUM("cusum"),
    ISOFOREST("isoforest"),
    RCF("rcf"),
    MATRIX_PROFILE("matrix_profile");

    private final String tag;

    DetectorType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /**
     * Whether detectors of this type score each row as a whole feature vector
     * rather than the primary metric alone.
     */
    public boolean isMultivariate() {
        return switch (this) {
            case ISOFOREST, RCF -> true;
            case STL_MAD, CUSUM, MATRIX_PROFILE -> false;
        };
    }

    /**
     * @return the matching type, or null if the tag is not recognised
     */
    @JsonCreator
    public static DetectorType fromTag(String tag) {
        if (tag == null) return null;
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (DetectorType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
