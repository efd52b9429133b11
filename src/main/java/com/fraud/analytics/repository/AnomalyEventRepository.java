package com.fraud.analytics.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.config.AerospikeConfig;
import com.fraud.analytics.model.AnomalyEvent;
import com.fraud.analytics.policy.PolicyAction;
import com.fraud.analytics.policy.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
public class AnomalyEventRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEventRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public AnomalyEventRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(AnomalyEvent event) {
        Key key = new Key(namespace, AerospikeConfig.SET_ANOMALY_EVENTS, event.getEventId());

        client.put(writePolicy, key,
                new Bin("eventId", event.getEventId()),
                new Bin("runId", event.getRunId()),
                new Bin("detectorId", event.getDetectorId()),
                new Bin("cohortValues", writeJson(event.getCohortValues(), "{}")),
                new Bin("metric", event.getMetric()),
                new Bin("timestamp", event.getTimestamp() == null ? 0L : event.getTimestamp().toEpochMilli()),
                new Bin("score", event.getScore()),
                new Bin("severity", event.getSeverity().name()),
                new Bin("persistedN", event.getPersistedN()),
                new Bin("evidence", writeJson(event.getEvidence(), "{}")),
                new Bin("policyAction", event.getPolicyAction().name()),
                new Bin("policyReason", event.getPolicyReason()));
    }

    public void saveAll(Collection<AnomalyEvent> events) {
        for (AnomalyEvent event : events) {
            save(event);
        }
    }

    public List<AnomalyEvent> findByDetectorId(String detectorId) {
        List<AnomalyEvent> events = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_EVENTS,
                (key, record) -> {
                    if (detectorId.equals(record.getString("detectorId"))) {
                        synchronized (events) {
                            events.add(mapRecord(record));
                        }
                    }
                });
        return events;
    }

    /**
     * Removes every event written for a run. Used to roll back a run that failed part-way.
     */
    public int deleteByRunId(String runId) {
        List<Key> keys = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ANOMALY_EVENTS,
                (key, record) -> {
                    if (runId.equals(record.getString("runId"))) {
                        synchronized (keys) {
                            keys.add(key);
                        }
                    }
                }, "runId");

        int deleted = 0;
        for (Key key : keys) {
            if (client.delete(writePolicy, key)) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Deleted {} events of run {}", deleted, runId);
        }
        return deleted;
    }

    private AnomalyEvent mapRecord(Record record) {
        long timestamp = record.getLong("timestamp");
        return AnomalyEvent.builder()
                .eventId(record.getString("eventId"))
                .runId(record.getString("runId"))
                .detectorId(record.getString("detectorId"))
                .cohortValues(readJson(record.getString("cohortValues"), new TypeReference<Map<String, String>>() {}, new LinkedHashMap<>()))
                .metric(record.getString("metric"))
                .timestamp(timestamp == 0L ? null : Instant.ofEpochMilli(timestamp))
                .score(record.getDouble("score"))
                .severity(Severity.valueOf(record.getString("severity")))
                .persistedN(record.getInt("persistedN"))
                .evidence(readJson(record.getString("evidence"), new TypeReference<Map<String, Object>>() {}, new LinkedHashMap<>()))
                .policyAction(PolicyAction.valueOf(record.getString("policyAction")))
                .policyReason(record.getString("policyReason"))
                .build();
    }

    private String writeJson(Object value, String fallback) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            log.error("Failed to serialize event field", e);
            return fallback;
        }
    }

    private <T> T readJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("Failed to deserialize event field", e);
            return fallback;
        }
    }
}
