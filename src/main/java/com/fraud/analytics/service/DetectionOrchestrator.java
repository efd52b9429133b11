package com.fraud.analytics.service;

import com.fraud.analytics.config.DetectionConfig;
import com.fraud.analytics.config.DetectionExecutorConfig;
import com.fraud.analytics.config.DetectionMetrics;
import com.fraud.analytics.detector.AnomalyDetector;
import com.fraud.analytics.detector.DetectorException;
import com.fraud.analytics.detector.DetectorFactory;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorResult;
import com.fraud.analytics.detector.EmptySeriesException;
import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.model.AnomalyEvent;
import com.fraud.analytics.model.DetectionRequest;
import com.fraud.analytics.model.DetectionRun;
import com.fraud.analytics.model.DetectorConfig;
import com.fraud.analytics.model.RunStatus;
import com.fraud.analytics.model.WindowRow;
import com.fraud.analytics.policy.PolicyDecision;
import com.fraud.analytics.policy.PolicyService;
import com.fraud.analytics.policy.Severity;
import com.fraud.analytics.policy.SeverityClassifier;
import com.fraud.analytics.repository.AnomalyEventRepository;
import com.fraud.analytics.repository.DetectionRunRepository;
import com.fraud.analytics.repository.DetectorConfigRepository;
import com.fraud.analytics.series.CohortSeriesAssembler;
import com.fraud.analytics.series.SeriesFetchException;
import com.fraud.analytics.series.SeriesSource;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs detectors over warehouse windows in the background and persists their anomaly events.
 *
 * Flow of a run:
 * 1. Validate the request, load the detector config and build the detector (synchronous)
 * 2. Persist a RUNNING run and return its id
 * 3. Fetch windows from the series source, bounded by the fetch timeout
 * 4. Split windows into cohorts and run the detector on each cohort series
 * 5. Classify severity and apply the policy to every anomalous point
 * 6. Persist all events, then mark the run COMPLETED
 *
 * Any failure marks the run FAILED and removes events already written for it, so a run's
 * events are visible either completely or not at all. Cancellation and fetch timeouts
 * interrupt the worker; the (detector, window) slot stays taken until the worker has exited.
 */
@Service
public class DetectionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DetectionOrchestrator.class);

    static final String CANCELLED = "cancelled";

    private final DetectorConfigRepository detectorConfigRepository;
    private final DetectionRunRepository runRepository;
    private final AnomalyEventRepository eventRepository;
    private final SeriesSource seriesSource;
    private final DetectorFactory detectorFactory;
    private final SeverityClassifier severityClassifier;
    private final PolicyService policyService;
    private final InvestigatorNotificationService notificationService;
    private final DetectionConfig detectionConfig;
    private final DetectionMetrics metrics;
    private final Tracer tracer;
    private final Executor executor;
    private final ScheduledExecutorService fetchDeadlines;

    // (detectorId, window) keys of runs whose worker has not exited yet
    private final Set<String> inFlightKeys = ConcurrentHashMap.newKeySet();
    private final Map<String, DetectionJob> inFlightRuns = new ConcurrentHashMap<>();

    public DetectionOrchestrator(DetectorConfigRepository detectorConfigRepository,
                                 DetectionRunRepository runRepository,
                                 AnomalyEventRepository eventRepository,
                                 SeriesSource seriesSource,
                                 DetectorFactory detectorFactory,
                                 SeverityClassifier severityClassifier,
                                 PolicyService policyService,
                                 InvestigatorNotificationService notificationService,
                                 DetectionConfig detectionConfig,
                                 DetectionMetrics metrics,
                                 Tracer tracer,
                                 @Qualifier(DetectionExecutorConfig.DETECTION_EXECUTOR) Executor executor) {
        this.detectorConfigRepository = detectorConfigRepository;
        this.runRepository = runRepository;
        this.eventRepository = eventRepository;
        this.seriesSource = seriesSource;
        this.detectorFactory = detectorFactory;
        this.severityClassifier = severityClassifier;
        this.policyService = policyService;
        this.notificationService = notificationService;
        this.detectionConfig = detectionConfig;
        this.metrics = metrics;
        this.tracer = tracer;
        this.executor = executor;
        this.fetchDeadlines = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "detection-fetch-deadline");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Accept a detection request and schedule it.
     *
     * @return the id of the RUNNING run
     * @throws IllegalArgumentException       if the detector id is missing or the window is empty
     * @throws DetectorNotFoundException      if no detector has this id
     * @throws DetectorDisabledException      if the detector is disabled
     * @throws InvalidDetectorConfigException if the detector has no primary metric or cohort list
     * @throws com.fraud.analytics.detector.UnknownDetectorTypeException if the detector's type has no implementation
     * @throws RunAlreadyInProgressException  if the same detector and window is already running
     */
    @Observed(name = "detection.submit", contextualName = "submit-detection-run")
    public String submit(DetectionRequest request) {
        validateRequest(request);

        DetectorConfig config = detectorConfigRepository.findById(request.getDetectorId());
        if (config == null) {
            throw new DetectorNotFoundException(request.getDetectorId());
        }
        if (!config.isEnabled()) {
            throw new DetectorDisabledException(config.getId());
        }
        validateConfig(config);

        AnomalyDetector detector = detectorFactory.create(config.getType(), config.getParams());

        String key = DetectionRun.inFlightKey(config.getId(), request.getWindowFrom(), request.getWindowTo());
        if (!inFlightKeys.add(key)) {
            throw new RunAlreadyInProgressException(config.getId(), request.getWindowFrom(), request.getWindowTo());
        }

        DetectionRun run;
        try {
            if (runRepository.findRunning(config.getId(), request.getWindowFrom(), request.getWindowTo()) != null) {
                throw new RunAlreadyInProgressException(config.getId(), request.getWindowFrom(), request.getWindowTo());
            }
            run = DetectionRun.builder()
                    .runId(UUID.randomUUID().toString())
                    .detectorId(config.getId())
                    .windowFrom(request.getWindowFrom())
                    .windowTo(request.getWindowTo())
                    .status(RunStatus.RUNNING)
                    .startedAt(Instant.now())
                    .build();
            runRepository.save(run);
        } catch (RuntimeException e) {
            inFlightKeys.remove(key);
            throw e;
        }

        metrics.recordRunSubmitted(detector.type().getTag());
        log.info("Detection run {} submitted: detector={} type={} window=[{}, {})",
                run.getRunId(), config.getId(), detector.type().getTag(),
                run.getWindowFrom(), run.getWindowTo());

        startJob(new DetectionJob(run, config, detector, key, request.getCohortFilters()));
        return run.getRunId();
    }

    /**
     * Current state of a run, including the error of a failed one.
     */
    public DetectionRun getRun(String runId) {
        DetectionRun run = runRepository.findById(runId);
        if (run == null) {
            throw new RunNotFoundException(runId);
        }
        return run;
    }

    /**
     * Cancel a run started by this process. The run is marked FAILED with "cancelled" and its
     * worker is interrupted.
     *
     * @return false if the run is not in flight here or has already finished
     */
    public boolean cancel(String runId) {
        return cancel(runId, CANCELLED);
    }

    private boolean cancel(String runId, String reason) {
        DetectionJob job = inFlightRuns.get(runId);
        return job != null && job.abort(new CancellationException(reason));
    }

    @PreDestroy
    public void shutdown() {
        if (!inFlightRuns.isEmpty()) {
            log.warn("Shutting down with {} detection runs in flight; cancelling them", inFlightRuns.size());
            for (String runId : List.copyOf(inFlightRuns.keySet())) {
                cancel(runId, CANCELLED + ": service shutting down");
            }
        }
        fetchDeadlines.shutdownNow();
    }

    int getInFlightCount() {
        return inFlightRuns.size();
    }

    private void validateRequest(DetectionRequest request) {
        if (request == null || request.getDetectorId() == null || request.getDetectorId().isBlank()) {
            throw new IllegalArgumentException("detector_id is required");
        }
        if (request.getWindowFrom() == null || request.getWindowTo() == null) {
            throw new IllegalArgumentException("window_from and window_to are required");
        }
        if (!request.getWindowFrom().isBefore(request.getWindowTo())) {
            throw new IllegalArgumentException(String.format(
                    "window_from (%s) must be before window_to (%s)", request.getWindowFrom(), request.getWindowTo()));
        }
    }

    private void validateConfig(DetectorConfig config) {
        if (config.getMetrics() == null || config.getMetrics().getPrimary() == null
                || config.getMetrics().getPrimary().isBlank()) {
            throw new InvalidDetectorConfigException(config.getId(), "no primary metric");
        }
        if (config.getCohortBy() == null) {
            throw new InvalidDetectorConfigException(config.getId(), "cohort_by is missing");
        }
    }

    private void startJob(DetectionJob job) {
        inFlightRuns.put(job.run.getRunId(), job);
        try {
            executor.execute(job);
        } catch (RejectedExecutionException e) {
            job.abort(new IllegalStateException("Detection worker pool is saturated", e));
        }
    }

    private List<AnomalyEvent> toEvents(DetectionRun run, AnomalyDetector detector,
                                        Map<String, String> cohortValues, MetricSeries series,
                                        DetectorResult result, Map<String, String> policyParams) {
        List<AnomalyEvent> events = new ArrayList<>();
        double[] primary = series.primary();
        int persisted = 0;
        int previous = -2;

        for (int index : result.getAnomalies()) {
            persisted = index == previous + 1 ? persisted + 1 : 1;
            previous = index;

            double score = result.scoreAt(index);
            Severity severity = severityClassifier.classify(score, detector.getK());
            PolicyDecision decision = policyService.decide(score, severity, persisted, policyParams);

            Map<String, Object> evidence = new LinkedHashMap<>(result.pointEvidence(index));
            evidence.put("value", primary[index]);
            evidence.put("k", detector.getK());

            events.add(AnomalyEvent.builder()
                    .eventId(UUID.randomUUID().toString())
                    .runId(run.getRunId())
                    .detectorId(run.getDetectorId())
                    .cohortValues(new LinkedHashMap<>(cohortValues))
                    .metric(series.primaryMetric())
                    .timestamp(series.timestampAt(index))
                    .score(score)
                    .severity(severity)
                    .persistedN(persisted)
                    .evidence(evidence)
                    .policyAction(decision.action())
                    .policyReason(decision.reason())
                    .build());

            metrics.recordEvent(detector.type().getTag(), severity.getLabel(), decision.action().getLabel(), score);
        }
        return events;
    }

    private static String failureMessage(Throwable cause) {
        String message = cause.getMessage();
        if (cause instanceof CancellationException) {
            return message != null ? message : CANCELLED;
        }
        return message != null ? message : cause.getClass().getSimpleName();
    }

    private static boolean isExpectedFailure(Throwable cause) {
        return cause instanceof DetectorException || cause instanceof SeriesFetchException
                || cause instanceof TimeoutException || cause instanceof CancellationException;
    }

    /**
     * One run. Exactly one of the worker (on completion or failure) or {@link #abort} finalizes
     * the run; the worker alone releases the run's slot, unless the job is aborted before any
     * worker picked it up.
     */
    private final class DetectionJob implements Runnable {

        private final DetectionRun run;
        private final DetectorConfig config;
        private final AnomalyDetector detector;
        private final String key;
        private final Map<String, String> cohortFilters;
        private final Span span;
        private final Instant started = Instant.now();

        private final AtomicBoolean claimed = new AtomicBoolean();
        private final AtomicBoolean finalized = new AtomicBoolean();
        private Thread worker;
        private volatile boolean fetching;
        private volatile boolean writingEvents;

        DetectionJob(DetectionRun run, DetectorConfig config, AnomalyDetector detector,
                     String key, Map<String, String> cohortFilters) {
            this.run = run;
            this.config = config;
            this.detector = detector;
            this.key = key;
            this.cohortFilters = cohortFilters;
            this.span = tracer.nextSpan()
                    .name("detection.run")
                    .tag("run.id", run.getRunId())
                    .tag("detector.id", config.getId())
                    .tag("detector.type", detector.type().getTag())
                    .start();
        }

        @Override
        public void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            setWorker(Thread.currentThread());
            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                List<WindowRow> rows = fetch();
                List<AnomalyEvent> events = detect(rows);
                persist(events);
            } catch (Exception e) {
                if (!fail(e) && writingEvents) {
                    // Aborted mid-write: drop whatever landed after the abort's cleanup.
                    deleteEvents();
                }
            } finally {
                setWorker(null);
                Thread.interrupted();
                release();
            }
        }

        /**
         * Fail the run from outside the worker and interrupt the worker if one is running.
         *
         * @return false if the run had already been finalized
         */
        boolean abort(Throwable cause) {
            if (!fail(cause)) {
                return false;
            }
            if (claimed.compareAndSet(false, true)) {
                release();
            } else {
                synchronized (this) {
                    if (worker != null) {
                        worker.interrupt();
                    }
                }
            }
            return true;
        }

        private synchronized void setWorker(Thread thread) {
            worker = thread;
        }

        private List<WindowRow> fetch() {
            ensureActive();
            long timeoutSeconds = detectionConfig.getFetchTimeoutSeconds();
            fetching = true;
            ScheduledFuture<?> deadline = fetchDeadlines.schedule(() -> {
                if (fetching) {
                    abort(new TimeoutException("Series fetch timed out after " + timeoutSeconds + "s"));
                }
            }, timeoutSeconds, TimeUnit.SECONDS);
            try {
                return seriesSource.fetchWindows(config.getCohortBy(), config.allMetrics(),
                        run.getWindowFrom(), run.getWindowTo(), cohortFilters);
            } catch (SeriesFetchException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SeriesFetchException("Series fetch failed: " + e.getMessage(), e);
            } finally {
                fetching = false;
                deadline.cancel(false);
            }
        }

        private List<AnomalyEvent> detect(List<WindowRow> rows) {
            ensureActive();
            Map<Map<String, String>, MetricSeries> cohorts =
                    CohortSeriesAssembler.assemble(rows, config.getCohortBy(), config.allMetrics());
            if (cohorts.isEmpty()) {
                throw new EmptySeriesException(detector.getMinSupport());
            }

            Map<String, String> policyParams =
                    detectionConfig.withDefaults(DetectorParams.of(config.getParams())).asMap();

            List<AnomalyEvent> events = new ArrayList<>();
            for (Map.Entry<Map<String, String>, MetricSeries> cohort : cohorts.entrySet()) {
                ensureActive();
                DetectorResult result = detector.detect(cohort.getValue());
                events.addAll(toEvents(run, detector, cohort.getKey(), cohort.getValue(), result, policyParams));
            }
            span.tag("run.cohorts", String.valueOf(cohorts.size()));
            span.tag("run.events", String.valueOf(events.size()));
            return events;
        }

        private void persist(List<AnomalyEvent> events) {
            ensureActive();
            writingEvents = true;
            eventRepository.saveAll(events);
            if (!finalized.compareAndSet(false, true)) {
                // Aborted while events were being written.
                deleteEvents();
                return;
            }
            if (!runRepository.markCompleted(run.getRunId(), events.size(), Instant.now())) {
                log.warn("Detection run {} was finalized elsewhere before it completed; removing its events",
                        run.getRunId());
                deleteEvents();
                close(RunStatus.FAILED);
                return;
            }
            log.info("Detection run {} completed: {} events in {} ms",
                    run.getRunId(), events.size(), Duration.between(started, Instant.now()).toMillis());
            close(RunStatus.COMPLETED);
            notifyInvestigators(events);
        }

        private void notifyInvestigators(List<AnomalyEvent> events) {
            try {
                notificationService.notifyInvestigations(config, run, events);
            } catch (RuntimeException e) {
                log.warn("Investigator alert for run {} was not dispatched: {}", run.getRunId(), e.getMessage());
            }
        }

        /**
         * Mark the run FAILED. Events are removed only when this call actually moved the run
         * out of RUNNING; a run another writer already finalized keeps its events.
         *
         * @return false if the run had already been finalized in this process
         */
        private boolean fail(Throwable cause) {
            if (!finalized.compareAndSet(false, true)) {
                return false;
            }
            String runId = run.getRunId();
            String message = failureMessage(cause);
            span.error(cause);
            if (isExpectedFailure(cause)) {
                log.warn("Detection run {} failed: {}", runId, message);
            } else {
                log.error("Detection run {} failed unexpectedly: {}", runId, message, cause);
            }

            try {
                if (runRepository.markFailed(runId, message, Instant.now())) {
                    eventRepository.deleteByRunId(runId);
                } else {
                    log.warn("Detection run {} was already finalized; leaving its events in place", runId);
                }
            } catch (RuntimeException e) {
                log.error("Could not record failure of run {}: {}", runId, e.getMessage(), e);
            }
            close(RunStatus.FAILED);
            return true;
        }

        private void deleteEvents() {
            try {
                eventRepository.deleteByRunId(run.getRunId());
            } catch (RuntimeException e) {
                log.error("Could not remove events of run {}: {}", run.getRunId(), e.getMessage(), e);
            }
        }

        private void ensureActive() {
            if (finalized.get() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Run " + run.getRunId() + " was stopped");
            }
        }

        private void close(RunStatus status) {
            span.tag("run.status", status.name());
            span.end();
            metrics.recordRunFinished(detector.type().getTag(), status.name(), Duration.between(started, Instant.now()));
        }

        private void release() {
            inFlightRuns.remove(run.getRunId(), this);
            inFlightKeys.remove(key);
        }
    }
}
