package com.fraud.analytics.service;

import com.fraud.analytics.config.DetectionExecutorConfig;
import com.fraud.analytics.config.DetectionMetrics;
import com.fraud.analytics.config.TwilioNotificationConfig;
import com.fraud.analytics.model.AnomalyEvent;
import com.fraud.analytics.model.DetectionRun;
import com.fraud.analytics.model.DetectorConfig;
import com.fraud.analytics.policy.PolicyAction;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.micrometer.observation.annotation.Observed;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class InvestigatorNotificationService {

    private static final Logger log = LoggerFactory.getLogger(InvestigatorNotificationService.class);

    private final TwilioNotificationConfig config;
    private final DetectionMetrics metrics;

    public InvestigatorNotificationService(TwilioNotificationConfig config, DetectionMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Investigator alerts initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Investigator alerts are DISABLED.");
        }
    }

    /**
     * Sends one alert per completed run that produced events with action investigate.
     * Delivery failures are logged and counted; they never affect the run.
     */
    @Async(DetectionExecutorConfig.ALERT_EXECUTOR)
    @Observed(name = "notification.send", contextualName = "send-investigator-alert")
    public void notifyInvestigations(DetectorConfig detector, DetectionRun run, List<AnomalyEvent> events) {
        if (!config.isEnabled()) {
            return;
        }
        List<AnomalyEvent> toInvestigate = events.stream()
                .filter(e -> e.getPolicyAction() == PolicyAction.INVESTIGATE)
                .sorted(Comparator.comparingDouble(AnomalyEvent::getScore).reversed())
                .toList();
        if (toInvestigate.isEmpty()) {
            return;
        }

        try {
            String body = buildMessageBody(detector, run, toInvestigate);
            String from = resolveNumber(config.getFromNumber());
            String to = resolveNumber(config.getToNumber());

            Message message = Message.creator(
                    new PhoneNumber(to),
                    new PhoneNumber(from),
                    body
            ).create();

            metrics.recordNotification(config.getChannel(), "success");
            log.info("Investigator alert sent for run={}, sid={}", run.getRunId(), message.getSid());
        } catch (Exception e) {
            metrics.recordNotification(config.getChannel(), "error");
            log.error("Failed to send investigator alert for run={}: {}", run.getRunId(), e.getMessage(), e);
        }
    }

    String buildMessageBody(DetectorConfig detector, DetectionRun run, List<AnomalyEvent> toInvestigate) {
        String top = toInvestigate.stream()
                .limit(Math.max(1, config.getMaxEventsInMessage()))
                .map(e -> String.format("- %s %s score=%.2f (%s)",
                        e.getTimestamp(), e.getCohortValues(), e.getScore(), e.getSeverity().getLabel()))
                .collect(Collectors.joining("\n"));

        return String.format(
                "[ANOMALY ALERT] %d event(s) to investigate\n" +
                "Detector: %s (%s)\n" +
                "Window: %s to %s\n" +
                "Run: %s\n" +
                "%s",
                toInvestigate.size(),
                detector.getName() != null ? detector.getName() : detector.getId(),
                detector.getType(),
                run.getWindowFrom(),
                run.getWindowTo(),
                run.getRunId(),
                top
        );
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
