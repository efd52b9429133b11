package com.fraud.analytics.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fraud.analytics.config.AerospikeConfig;
import com.fraud.analytics.model.DetectionRun;
import com.fraud.analytics.model.RunStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class DetectionRunRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DetectionRunRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                  @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public void save(DetectionRun run) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, run.getRunId());

        client.put(writePolicy, key,
                new Bin("runId", run.getRunId()),
                new Bin("detectorId", run.getDetectorId()),
                new Bin("windowFrom", run.getWindowFrom().toEpochMilli()),
                new Bin("windowTo", run.getWindowTo().toEpochMilli()),
                new Bin("status", run.getStatus().name()),
                new Bin("startedAt", toMillis(run.getStartedAt())),
                new Bin("completedAt", toMillis(run.getCompletedAt())),
                new Bin("eventCount", run.getEventCount()),
                new Bin("error", run.getError()));
    }

    public DetectionRun findById(String runId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<DetectionRun> findByDetectorId(String detectorId) {
        List<DetectionRun> runs = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_RUNS,
                (key, record) -> {
                    if (detectorId.equals(record.getString("detectorId"))) {
                        synchronized (runs) {
                            runs.add(mapRecord(record));
                        }
                    }
                });

        runs.sort(Comparator.comparing(DetectionRun::getStartedAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return runs;
    }

    /**
     * The RUNNING run for this detector and window, if any. Survives restarts of this process,
     * unlike the orchestrator's in-memory key set.
     */
    public DetectionRun findRunning(String detectorId, Instant windowFrom, Instant windowTo) {
        String wanted = DetectionRun.inFlightKey(detectorId, windowFrom, windowTo);
        return findByDetectorId(detectorId).stream()
                .filter(run -> run.getStatus() == RunStatus.RUNNING)
                .filter(run -> wanted.equals(DetectionRun.inFlightKey(
                        run.getDetectorId(), run.getWindowFrom(), run.getWindowTo())))
                .findFirst()
                .orElse(null);
    }

    public boolean markCompleted(String runId, int eventCount, Instant completedAt) {
        return transition(runId, RunStatus.COMPLETED,
                new Bin("status", RunStatus.COMPLETED.name()),
                new Bin("eventCount", eventCount),
                new Bin("completedAt", completedAt.toEpochMilli()));
    }

    public boolean markFailed(String runId, String error, Instant completedAt) {
        return transition(runId, RunStatus.FAILED,
                new Bin("status", RunStatus.FAILED.name()),
                new Bin("error", error),
                new Bin("completedAt", completedAt.toEpochMilli()));
    }

    /**
     * Moves a RUNNING run to a terminal status. The write is conditioned on the generation read,
     * so a concurrent transition wins at most once; terminal runs are left untouched.
     */
    private boolean transition(String runId, RunStatus target, Bin... bins) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RUNS, runId);
        Record record = client.get(readPolicy, key);
        if (record == null) {
            log.warn("Cannot mark run {} {}: run not found", runId, target);
            return false;
        }

        RunStatus current = RunStatus.valueOf(record.getString("status"));
        if (current.isTerminal()) {
            log.warn("Run {} is already {}; ignoring transition to {}", runId, current, target);
            return false;
        }

        WritePolicy conditional = new WritePolicy(writePolicy);
        conditional.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        conditional.generation = record.generation;
        try {
            client.put(conditional, key, bins);
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.warn("Run {} changed concurrently; transition to {} skipped", runId, target);
                return false;
            }
            throw e;
        }
    }

    private DetectionRun mapRecord(Record record) {
        return DetectionRun.builder()
                .runId(record.getString("runId"))
                .detectorId(record.getString("detectorId"))
                .windowFrom(Instant.ofEpochMilli(record.getLong("windowFrom")))
                .windowTo(Instant.ofEpochMilli(record.getLong("windowTo")))
                .status(RunStatus.valueOf(record.getString("status")))
                .startedAt(fromMillis(record.getLong("startedAt")))
                .completedAt(fromMillis(record.getLong("completedAt")))
                .eventCount(record.getInt("eventCount"))
                .error(record.getString("error"))
                .build();
    }

    private static long toMillis(Instant instant) {
        return instant == null ? 0L : instant.toEpochMilli();
    }

    private static Instant fromMillis(long millis) {
        return millis == 0L ? null : Instant.ofEpochMilli(millis);
    }
}
