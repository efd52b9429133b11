package com.fraud.analytics.service;

import com.fraud.analytics.config.DetectionMetrics;
import com.fraud.analytics.config.TwilioNotificationConfig;
import com.fraud.analytics.model.AnomalyEvent;
import com.fraud.analytics.model.DetectionRun;
import com.fraud.analytics.model.DetectorConfig;
import com.fraud.analytics.model.RunStatus;
import com.fraud.analytics.policy.PolicyAction;
import com.fraud.analytics.policy.Severity;
import com.fraud.analytics.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fraud.analytics.testutil.TestDataFactory.WINDOW_FROM;
import static org.assertj.core.api.Assertions.assertThat;

class InvestigatorNotificationServiceTest {

    private TwilioNotificationConfig config;
    private SimpleMeterRegistry registry;
    private InvestigatorNotificationService service;

    private final DetectorConfig detector =
            TestDataFactory.createDetectorConfig("det-1", "cusum", Map.of());
    private final DetectionRun run = TestDataFactory.createRun("run-1", "det-1", RunStatus.COMPLETED);

    @BeforeEach
    void setUp() {
        config = new TwilioNotificationConfig();
        registry = new SimpleMeterRegistry();
        service = new InvestigatorNotificationService(config, new DetectionMetrics(registry));
    }

    private static AnomalyEvent event(String id, double score, PolicyAction action) {
        return TestDataFactory.createEvent(id, "run-1", WINDOW_FROM, score, Severity.CRITICAL, action);
    }

    @Test
    void notify_disabled_sendsNothing() {
        service.init();
        service.notifyInvestigations(detector, run, List.of(event("e1", 9.0, PolicyAction.INVESTIGATE)));

        assertThat(registry.find("notification.sent.count").counter()).isNull();
    }

    @Test
    void notify_noInvestigateEvents_sendsNothing() {
        config.setEnabled(true);
        service.notifyInvestigations(detector, run, List.of(
                event("e1", 4.0, PolicyAction.MONITOR),
                event("e2", 1.0, PolicyAction.IGNORE)));

        assertThat(registry.find("notification.sent.count").counter()).isNull();
    }

    @Test
    void buildMessageBody_listsHighestScoresUpToLimit() {
        config.setMaxEventsInMessage(2);
        List<AnomalyEvent> events = List.of(
                event("e1", 9.5, PolicyAction.INVESTIGATE),
                event("e2", 7.25, PolicyAction.INVESTIGATE),
                event("e3", 6.0, PolicyAction.INVESTIGATE));

        String body = service.buildMessageBody(detector, run, events);

        assertThat(body).startsWith("[ANOMALY ALERT] 3 event(s) to investigate");
        assertThat(body).contains("Detector: Detector det-1 (cusum)");
        assertThat(body).contains("Run: run-1");
        assertThat(body).contains("score=9.50 (critical)", "score=7.25");
        assertThat(body).doesNotContain("score=6.00");
    }
}
