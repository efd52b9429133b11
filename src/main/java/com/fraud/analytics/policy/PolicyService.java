package com.fraud.analytics.policy;

import com.fraud.analytics.config.DetectionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Runs the policy engine for the detection pipeline with diagnostic logging and metrics.
 */
@Service
public class PolicyService {

    private static final Logger log = LoggerFactory.getLogger(PolicyService.class);

    private final DetectionMetrics metrics;

    public PolicyService(DetectionMetrics metrics) {
        this.metrics = metrics;
    }

    public PolicyDecision decide(Double score, Severity severity, Integer persistedN, Map<String, String> detectorParams) {
        PolicyDecision decision = PolicyEngine.decideAction(score, severity, persistedN, detectorParams);

        if (decision.rule() == PolicyRule.MALFORMED_INPUT) {
            log.warn("Policy input malformed (score={}, severity={}, persistedN={}): {}",
                    score, severity, persistedN, decision.reason());
        } else {
            log.debug("Policy decision {} via {}: {}", decision.action(), decision.rule(), decision.reason());
        }
        metrics.recordPolicyDecision(decision.action().getLabel(), decision.rule().name());
        return decision;
    }
}
