package com.fraud.analytics.detector.isolationforest;

import com.fraud.analytics.detector.BaseDetector;
import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorResult;
import com.fraud.analytics.detector.DetectorType;
import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.detector.stats.RobustStats;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Multivariate detector: each window is a feature vector of all configured metrics.
 *
 * An isolation forest is fitted over every row of the window, then the raw forest score
 * (0..1) is normalised to a robust z-score against the window's own score distribution:
 *
 *   score = max(0, raw - median(raw)) / (1.4826 × MAD(raw))
 *
 * Rows scoring above k are anomalies. min_support applies to the number of rows.
 * The contamination fraction does not gate anomalies; it fixes the raw-score cut-off
 * reported in the evidence, mirroring the classic offset-based decision function.
 */
public class IsolationForestDetector extends BaseDetector {

    public static final String N_ESTIMATORS = "n_estimators";
    public static final String MAX_SAMPLES = "max_samples";
    public static final String CONTAMINATION = "contamination";
    public static final String RANDOM_STATE = "random_state";

    public static final int DEFAULT_N_ESTIMATORS = 100;
    public static final int DEFAULT_MAX_SAMPLES = 256;
    public static final double DEFAULT_CONTAMINATION = 0.1;
    public static final long DEFAULT_RANDOM_STATE = 42L;

    private final int numEstimators;
    private final int maxSamples;
    private final double contamination;
    private final long randomState;

    public IsolationForestDetector(DetectorParams params) {
        super(params);
        this.numEstimators = Math.max(1, this.params.getInt(N_ESTIMATORS, DEFAULT_N_ESTIMATORS));
        this.maxSamples = Math.max(2, this.params.getInt(MAX_SAMPLES, DEFAULT_MAX_SAMPLES));
        double c = this.params.getDouble(CONTAMINATION, DEFAULT_CONTAMINATION);
        this.contamination = c > 0 && c <= 0.5 ? c : DEFAULT_CONTAMINATION;
        this.randomState = this.params.getLong(RANDOM_STATE, DEFAULT_RANDOM_STATE);
    }

    @Override
    public DetectorType type() {
        return DetectorType.ISOFOREST;
    }

    @Override
    protected DetectorResult score(MetricSeries series) {
        double[][] rows = series.rows();
        int n = rows.length;

        IsolationForest forest = IsolationForest.fit(rows, numEstimators, maxSamples, randomState);
        double[] raw = forest.scoreAll(rows);

        double median = RobustStats.median(raw);
        double mad = Math.max(RobustStats.mad(raw), RobustStats.EPSILON);
        double scale = RobustStats.MAD_SCALE * mad;
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            scores[i] = Math.max(0.0, raw[i] - median) / scale;
        }
        int[] anomalies = filterAnomalies(scores);

        double cutoff = RobustStats.quantile(raw, 1.0 - contamination);
        int[] contaminationOutliers = IntStream.range(0, n).filter(i -> raw[i] > cutoff).toArray();

        List<String> featureNames = series.getMetricNames();
        double[] columnMeans = columnMeans(rows, featureNames.size());
        Map<Integer, Map<String, Double>> contributions = new LinkedHashMap<>();
        for (int idx : anomalies) {
            double[] perFeature = forest.featureContributions(rows[idx], columnMeans);
            Map<String, Double> named = new LinkedHashMap<>();
            for (int j = 0; j < perFeature.length; j++) {
                named.put(featureNames.get(j), perFeature[j]);
            }
            contributions.put(idx, named);
        }

        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("raw_scores", raw);
        evidence.put("features", rows);
        evidence.put("feature_names", featureNames);
        evidence.put("feature_contributions", contributions);
        evidence.put("raw_score_median", median);
        evidence.put("raw_score_mad", mad);
        evidence.put("contamination", contamination);
        evidence.put("contamination_threshold", cutoff);
        evidence.put("contamination_outliers", contaminationOutliers);
        evidence.put("n_estimators", forest.getTreeCount());
        evidence.put("max_samples", forest.getSampleSize());

        return new DetectorResult(type(), scores, anomalies, evidence);
    }

    private static double[] columnMeans(double[][] rows, int width) {
        double[] means = new double[width];
        for (double[] row : rows) {
            for (int j = 0; j < width; j++) {
                means[j] += row[j];
            }
        }
        for (int j = 0; j < width; j++) {
            means[j] /= rows.length;
        }
        return means;
    }

    public int getNumEstimators() { return numEstimators; }
    public double getContamination() { return contamination; }
}
