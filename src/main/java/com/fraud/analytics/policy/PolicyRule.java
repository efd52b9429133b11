package com.fraud.analytics.policy;

/**
 * Which branch of the policy produced a decision, in precedence order.
 */
public enum PolicyRule {
    CRITICAL_SEVERITY,
    PERSISTENT_WARNING,
    SCORE_OVERRIDE,
    WARNING,
    BELOW_THRESHOLD,
    MALFORMED_INPUT
}
