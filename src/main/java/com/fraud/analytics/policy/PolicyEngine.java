package com.fraud.analytics.policy;

import com.fraud.analytics.detector.DetectorParams;

import java.util.Map;

/**
 * Maps an anomaly's score, severity and persistence to an operational action.
 *
 * Precedence, first match wins:
 *   1. severity critical                                  → investigate
 *   2. severity warn and persistedN >= params.persistence → investigate
 *   3. score > 5.0 (regardless of severity)               → investigate
 *   4. severity warn                                      → monitor
 *   5. anything else                                      → ignore
 *
 * Pure and total: identical inputs give identical decisions, and missing or malformed inputs
 * yield ignore with a reason naming the problem instead of an exception.
 */
public final class PolicyEngine {

    public static final double SCORE_OVERRIDE_THRESHOLD = 5.0;

    private PolicyEngine() {}

    public static PolicyDecision decideAction(Double score, Severity severity, Integer persistedN,
                                              Map<String, String> detectorParams) {
        if (score == null) {
            return malformed("score is missing");
        }
        if (!Double.isFinite(score)) {
            return malformed("score is not finite (" + score + ")");
        }
        if (severity == null) {
            return malformed("severity is missing");
        }
        if (persistedN == null) {
            return malformed("persisted_n is missing");
        }

        int persistence = Math.max(1, DetectorParams.of(detectorParams).persistence());

        if (severity == Severity.CRITICAL) {
            return new PolicyDecision(PolicyAction.INVESTIGATE, PolicyRule.CRITICAL_SEVERITY,
                    String.format("Critical severity (score=%.3f)", score));
        }
        if (severity == Severity.WARN && persistedN >= persistence) {
            return new PolicyDecision(PolicyAction.INVESTIGATE, PolicyRule.PERSISTENT_WARNING,
                    String.format("Warning persisted for %d consecutive windows (persistence=%d)",
                            persistedN, persistence));
        }
        if (score > SCORE_OVERRIDE_THRESHOLD) {
            return new PolicyDecision(PolicyAction.INVESTIGATE, PolicyRule.SCORE_OVERRIDE,
                    String.format("Score %.3f exceeds override threshold %.1f (severity=%s)",
                            score, SCORE_OVERRIDE_THRESHOLD, severity.getLabel()));
        }
        if (severity == Severity.WARN) {
            return new PolicyDecision(PolicyAction.MONITOR, PolicyRule.WARNING,
                    String.format("Warning seen for %d of %d required consecutive windows (score=%.3f)",
                            persistedN, persistence, score));
        }
        return new PolicyDecision(PolicyAction.IGNORE, PolicyRule.BELOW_THRESHOLD,
                String.format("Severity %s with score %.3f does not warrant action", severity.getLabel(), score));
    }

    /**
     * Overload for string-typed inputs as stored upstream; an unknown severity label is malformed.
     */
    public static PolicyDecision decideAction(Double score, String severity, Integer persistedN,
                                              Map<String, String> detectorParams) {
        Severity parsed = Severity.fromLabel(severity);
        if (parsed == null) {
            return malformed(severity == null ? "severity is missing" : "unknown severity '" + severity + "'");
        }
        return decideAction(score, parsed, persistedN, detectorParams);
    }

    private static PolicyDecision malformed(String problem) {
        return new PolicyDecision(PolicyAction.IGNORE, PolicyRule.MALFORMED_INPUT,
                "Defaulted to ignore: " + problem);
    }
}
