package com.fraud.analytics.detector.cusum;

import com.fraud.analytics.detector.BaseDetector;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorResult;
import com.fraud.analytics.detector.DetectorType;
import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.detector.stats.RobustStats;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two-sided CUSUM control chart for persistent level shifts in the primary metric.
 *
 *   s_pos[t] = max(0, s_pos[t-1] + (x[t] - mean) - delta)
 *   s_neg[t] = max(0, s_neg[t-1] - (x[t] - mean) - delta)
 *   score[t] = max(s_pos[t], s_neg[t]) / threshold
 *
 * A point is anomalous when score > k, i.e. the cumulative statistic exceeds k × threshold.
 * The statistics are not reset after an alarm, so a shift yields a contiguous anomalous region
 * starting at the changepoint.
 *
 * The in-control mean and standard deviation come from the leading {@code baseline_fraction}
 * of the series. When {@code delta} / {@code threshold} are not configured they are derived
 * from that standard deviation ({@code drift_sigma} × σ and {@code threshold_sigma} × σ).
 */
public class CusumDetector extends BaseDetector {

    public static final String DELTA = "delta";
    public static final String THRESHOLD = "threshold";
    public static final String BASELINE_FRACTION = "baseline_fraction";
    public static final String DRIFT_SIGMA = "drift_sigma";
    public static final String THRESHOLD_SIGMA = "threshold_sigma";

    public static final double DEFAULT_BASELINE_FRACTION = 0.25;
    public static final double DEFAULT_DRIFT_SIGMA = 0.5;
    public static final double DEFAULT_THRESHOLD_SIGMA = 5.0;

    private static final int MIN_BASELINE_POINTS = 2;

    private final double baselineFraction;
    private final double driftSigma;
    private final double thresholdSigma;

    public CusumDetector(DetectorParams params) {
        super(params);
        double fraction = this.params.getDouble(BASELINE_FRACTION, DEFAULT_BASELINE_FRACTION);
        this.baselineFraction = fraction > 0 && fraction <= 1.0 ? fraction : DEFAULT_BASELINE_FRACTION;
        this.driftSigma = this.params.getDouble(DRIFT_SIGMA, DEFAULT_DRIFT_SIGMA);
        this.thresholdSigma = this.params.getDouble(THRESHOLD_SIGMA, DEFAULT_THRESHOLD_SIGMA);
    }

    @Override
    public DetectorType type() {
        return DetectorType.CUSUM;
    }

    @Override
    protected DetectorResult score(MetricSeries series) {
        double[] values = series.primary();
        int n = values.length;

        int baselineSize = Math.min(n, Math.max(MIN_BASELINE_POINTS, (int) Math.floor(n * baselineFraction)));
        double[] baseline = Arrays.copyOf(values, baselineSize);
        double mean = RobustStats.mean(baseline);
        double std = Math.max(RobustStats.stdDev(baseline), RobustStats.EPSILON);

        double delta = params.contains(DELTA) ? Math.abs(params.getDouble(DELTA, driftSigma * std)) : driftSigma * std;
        double threshold = params.contains(THRESHOLD) ? params.getDouble(THRESHOLD, thresholdSigma * std) : thresholdSigma * std;
        if (!(threshold > RobustStats.EPSILON)) {
            threshold = Math.max(thresholdSigma * std, RobustStats.EPSILON);
        }

        double[] sPos = new double[n];
        double[] sNeg = new double[n];
        double[] scores = new double[n];
        double pos = 0.0;
        double neg = 0.0;
        for (int t = 0; t < n; t++) {
            double deviation = values[t] - mean;
            pos = Math.max(0.0, pos + deviation - delta);
            neg = Math.max(0.0, neg - deviation - delta);
            sPos[t] = pos;
            sNeg[t] = neg;
            scores[t] = Math.max(pos, neg) / threshold;
        }

        int[] anomalies = filterAnomalies(scores);
        int changepoint = anomalies.length > 0 ? anomalies[0] : -1;
        String direction = "none";
        if (changepoint >= 0) {
            direction = sPos[changepoint] >= sNeg[changepoint] ? "up" : "down";
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("s_pos", sPos);
        evidence.put("s_neg", sNeg);
        evidence.put("changepoint_index", changepoint);
        evidence.put("direction", direction);
        evidence.put("mean", mean);
        evidence.put("std", std);
        evidence.put("delta", delta);
        evidence.put("threshold", threshold);
        evidence.put("baseline_size", baselineSize);

        return new DetectorResult(type(), scores, anomalies, evidence);
    }
}
