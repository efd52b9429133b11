package com.fraud.analytics.service;

import com.fraud.analytics.model.AnomalyEvent;
import com.fraud.analytics.model.DetectionRun;
import com.fraud.analytics.model.RunStatus;
import com.fraud.analytics.repository.AnomalyEventRepository;
import com.fraud.analytics.repository.DetectionRunRepository;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class AnomalyQueryService {

    private final DetectionRunRepository runRepository;
    private final AnomalyEventRepository eventRepository;

    public AnomalyQueryService(DetectionRunRepository runRepository,
                               AnomalyEventRepository eventRepository) {
        this.runRepository = runRepository;
        this.eventRepository = eventRepository;
    }

    /**
     * Events of the detector's completed runs, newest window first. Events of running or failed
     * runs are never returned.
     */
    @Observed(name = "anomalies.list", contextualName = "list-anomaly-events")
    public List<AnomalyEvent> listEvents(String detectorId) {
        if (detectorId == null || detectorId.isBlank()) {
            throw new IllegalArgumentException("detector_id is required");
        }

        Set<String> completedRuns = runRepository.findByDetectorId(detectorId).stream()
                .filter(run -> run.getStatus() == RunStatus.COMPLETED)
                .map(DetectionRun::getRunId)
                .collect(Collectors.toSet());
        if (completedRuns.isEmpty()) {
            return List.of();
        }

        return eventRepository.findByDetectorId(detectorId).stream()
                .filter(event -> completedRuns.contains(event.getRunId()))
                .sorted(Comparator.comparing(AnomalyEvent::getTimestamp,
                                Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(Comparator.comparingDouble(AnomalyEvent::getScore).reversed()))
                .toList();
    }
}
