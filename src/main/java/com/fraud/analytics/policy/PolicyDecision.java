package com.fraud.analytics.policy;

/**
 * Outcome of the policy engine with the rule that fired and a human-readable reason.
 */
public record PolicyDecision(PolicyAction action, PolicyRule rule, String reason) {
}
