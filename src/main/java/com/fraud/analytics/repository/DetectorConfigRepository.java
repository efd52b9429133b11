package com.fraud.analytics.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fraud.analytics.config.AerospikeConfig;
import com.fraud.analytics.model.DetectorConfig;
import com.fraud.analytics.model.MetricSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only access to detector definitions. Writes belong to the configuration service.
 */
@Repository
public class DetectorConfigRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfigRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DetectorConfigRepository(AerospikeClient client,
                                    @Qualifier("aerospikeNamespace") String namespace,
                                    @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper();
    }

    public DetectorConfig findById(String detectorId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTORS, detectorId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;

        return DetectorConfig.builder()
                .id(detectorId)
                .name(record.getString("name"))
                .tenant(record.getString("tenant"))
                .type(record.getString("type"))
                .cohortBy(readJson(record.getString("cohortBy"), new TypeReference<List<String>>() {}, new ArrayList<>()))
                .metrics(readJson(record.getString("metrics"), new TypeReference<MetricSpec>() {}, null))
                .params(readJson(record.getString("params"), new TypeReference<Map<String, String>>() {}, new HashMap<>()))
                .enabled(record.getBoolean("enabled"))
                .build();
    }

    private <T> T readJson(String json, TypeReference<T> type, T fallback) {
        if (json == null || json.isEmpty()) return fallback;
        try {
            return objectMapper.readValue(json, type);
        } catch (Exception e) {
            log.error("Failed to deserialize detector field: {}", json, e);
            return fallback;
        }
    }
}
