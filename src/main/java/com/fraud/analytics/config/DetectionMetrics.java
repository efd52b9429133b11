package com.fraud.analytics.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

@Component
public class DetectionMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger inFlightRuns;

    public DetectionMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.inFlightRuns = registry.gauge("detection.runs.in_flight", new AtomicInteger(0));
    }

    public void recordRunSubmitted(String detectorType) {
        inFlightRuns.incrementAndGet();
        Counter.builder("detection.runs.submitted")
                .tag("detector_type", detectorType)
                .register(registry)
                .increment();
    }

    public void recordRunFinished(String detectorType, String status, Duration elapsed) {
        inFlightRuns.decrementAndGet();
        Counter.builder("detection.runs.finished")
                .tag("detector_type", detectorType)
                .tag("status", status)
                .register(registry)
                .increment();

        Timer.builder("detection.run.duration")
                .tag("detector_type", detectorType)
                .tag("status", status)
                .register(registry)
                .record(elapsed);
    }

    public void recordEvent(String detectorType, String severity, String action, double score) {
        Counter.builder("detection.events.count")
                .tag("detector_type", detectorType)
                .tag("severity", severity)
                .tag("action", action)
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.events.score")
                .tag("detector_type", detectorType)
                .register(registry)
                .record(score);
    }

    public void recordPolicyDecision(String action, String rule) {
        Counter.builder("policy.decisions.count")
                .tag("action", action)
                .tag("rule", rule)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public int getInFlightRuns() {
        return inFlightRuns.get();
    }
}
