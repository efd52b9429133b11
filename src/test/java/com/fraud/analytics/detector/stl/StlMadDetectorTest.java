package com.fraud.analytics.detector.stl;

import com.fraud.analytics.detector.DetectorParams;
import com.fraud.analytics.detector.DetectorResult;
import com.fraud.analytics.detector.MetricSeries;
import com.fraud.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StlMadDetectorTest {

    @Test
    void detect_spikeInShortSeries_flaggedWithShrunkPeriod() {
        double[] values = TestDataFactory.gaussian(42L, 100, 100, 10);
        values[50] = 300;
        StlMadDetector detector = new StlMadDetector(DetectorParams.of(Map.of("k", "3.0", "min_support", "24")));

        DetectorResult result = detector.detect(MetricSeries.of(values));

        assertThat(result.getAnomalies()).contains(50);
        assertThat(result.getEvidence())
                .containsEntry("period_shrunk", true)
                .containsEntry("requested_period", StlMadDetector.DEFAULT_PERIOD)
                .containsEntry("period", 50);
    }

    @Test
    void detect_spikeOnSeasonalSeries_flaggedAtSpikeOnly() {
        double[] values = TestDataFactory.gaussian(7L, 240, 100, 5);
        for (int i = 0; i < values.length; i++) {
            values[i] += 30 * Math.sin(2 * Math.PI * i / 24.0);
        }
        values[130] += 100;
        StlMadDetector detector = new StlMadDetector(DetectorParams.of(Map.of("k", "4", "period", "24")));

        DetectorResult result = detector.detect(MetricSeries.of(values));

        assertThat(result.getAnomalies()).contains(130);
        assertThat(result.scoreAt(130)).isEqualTo(maxOf(result.getScores()));
        assertThat(result.getEvidence()).containsEntry("period_shrunk", false).containsEntry("period", 24);
    }

    @Test
    void detect_robustMode_flagsSpike() {
        double[] values = TestDataFactory.gaussian(11L, 192, 100, 10);
        values[100] = 350;
        StlMadDetector detector = new StlMadDetector(DetectorParams.of(Map.of(
                "k", "3", "period", "48", "robust", "true")));

        DetectorResult result = detector.detect(MetricSeries.of(values));

        assertThat(result.getAnomalies()).contains(100);
        assertThat(result.getEvidence()).containsEntry("robust", true);
    }

    @Test
    void detect_residualsReconstructSeries() {
        double[] values = TestDataFactory.gaussian(3L, 96, 50, 4);
        StlMadDetector detector = new StlMadDetector(DetectorParams.of(Map.of("period", "12")));

        DetectorResult result = detector.detect(MetricSeries.of(values));

        double[] trend = (double[]) result.getEvidence().get("trend");
        double[] seasonal = (double[]) result.getEvidence().get("seasonal");
        double[] residuals = (double[]) result.getEvidence().get("residuals");
        for (int i = 0; i < values.length; i++) {
            assertThat(trend[i] + seasonal[i] + residuals[i]).isCloseTo(values[i], org.assertj.core.api.Assertions.within(1e-9));
        }
    }

    @Test
    void effectivePeriod_shrinksOnlyBelowTwoCycles() {
        StlMadDetector detector = new StlMadDetector(DetectorParams.of(Map.of("period", "24")));

        assertThat(detector.effectivePeriod(48)).isEqualTo(24);
        assertThat(detector.effectivePeriod(47)).isEqualTo(23);
        assertThat(detector.effectivePeriod(3)).isEqualTo(2);
    }

    private static double maxOf(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) max = Math.max(max, v);
        return max;
    }
}
