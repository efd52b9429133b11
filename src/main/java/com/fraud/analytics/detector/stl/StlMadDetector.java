package com.fraud.analytics.detector.stl;

import com.fraud.analytics.detector.BaseDetector;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorResult;
import com.fraud.analytics.detector.DetectorType;
import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.detector.stats.RobustStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Seasonal decomposition followed by robust residual scoring.
 *
 * The primary metric is split into trend + seasonal + residual, then each point is scored by
 * its residual in MAD units: score = |residual| / (1.4826 × MAD). The 1.4826 factor puts MAD
 * on the scale of a normal standard deviation, so k reads like a z threshold.
 *
 * Short series: when fewer than two full periods are available the period is shrunk to
 * n / 2 (minimum 2). The decomposition of such a window is degenerate, so the shrink is logged
 * at WARN and reported in the evidence ({@code period_shrunk}, {@code requested_period}).
 *
 * Params:
 *   period             seasonal period in windows (default 672 = 7 days of 15-minute windows)
 *   robust             median smoothing with bisquare reweighting (default false)
 *   seasonal_smoother  odd window, in cycles, for the cycle-subseries smoother (default 7)
 *   trend_window       odd trend window in points (default: smallest odd > period)
 */
public class StlMadDetector extends BaseDetector {

    private static final Logger log = LoggerFactory.getLogger(StlMadDetector.class);

    public static final String PERIOD = "period";
    public static final String ROBUST = "robust";
    public static final String SEASONAL_SMOOTHER = "seasonal_smoother";
    public static final String TREND_WINDOW = "trend_window";

    public static final int DEFAULT_PERIOD = 672;
    public static final int DEFAULT_SEASONAL_SMOOTHER = 7;

    private final int requestedPeriod;
    private final boolean robust;
    private final int seasonalSmoother;

    public StlMadDetector(DetectorParams params) {
        this(params, DEFAULT_PERIOD);
    }

    public StlMadDetector(DetectorParams params, int defaultPeriod) {
        super(params);
        this.requestedPeriod = Math.max(2, this.params.getInt(PERIOD, defaultPeriod));
        this.robust = this.params.getBoolean(ROBUST, false);
        this.seasonalSmoother = this.params.getInt(SEASONAL_SMOOTHER, DEFAULT_SEASONAL_SMOOTHER);
    }

    @Override
    public DetectorType type() {
        return DetectorType.STL_MAD;
    }

    @Override
    protected DetectorResult score(MetricSeries series) {
        double[] values = series.primary();
        int n = values.length;

        int period = effectivePeriod(n);
        boolean shrunk = period != requestedPeriod;
        if (shrunk) {
            log.warn("Series of {} points is shorter than two periods of {}; shrinking period to {}. " +
                            "Decomposition over fewer than two cycles is degenerate, treat scores with care.",
                    n, requestedPeriod, period);
        }

        int trendWindow = params.getInt(TREND_WINDOW, StlDecomposer.defaultTrendWindow(period));
        StlDecomposer decomposer = new StlDecomposer(period, trendWindow, seasonalSmoother, robust);
        SeasonalDecomposition decomposition = decomposer.decompose(values);

        double[] residuals = decomposition.residual();
        double mad = Math.max(RobustStats.mad(residuals), RobustStats.EPSILON);
        double scale = RobustStats.MAD_SCALE * mad;

        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = Math.abs(residuals[i]) / scale;
        }
        int[] anomalies = filterAnomalies(scores);

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("residuals", residuals);
        evidence.put("trend", decomposition.trend());
        evidence.put("seasonal", decomposition.seasonal());
        evidence.put("mad", mad);
        evidence.put("period", period);
        evidence.put("requested_period", requestedPeriod);
        evidence.put("period_shrunk", shrunk);
        evidence.put("robust", robust);
        evidence.put("trend_window", decomposer.getTrendWindow());

        log.debug("STL+MAD scored {} points: period={}, mad={}, anomalies={}", n, period, mad, anomalies.length);
        return new DetectorResult(type(), scores, anomalies, evidence);
    }

    /**
     * Period actually used for a series of {@code n} points.
     */
    int effectivePeriod(int n) {
        if (n < 2 * requestedPeriod) {
            return Math.max(2, n / 2);
        }
        return requestedPeriod;
    }

    public int getRequestedPeriod() { return requestedPeriod; }
    public boolean isRobust() { return robust; }
}
