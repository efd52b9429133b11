package com.fraud.analytics.detector;

import com.fraud.analytics.detector.cusum.CusumDetector;
import com.fraud.analytics.detector.isolationforest.IsolationForestDetector;
import com.fraud.analytics.detector.stl.StlMadDetector;
import com.fraud.analytics.testutil.TestDataFactory;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Validation and result-shape guarantees shared by every detector.
 */
class DetectorContractTest {

    private static final DetectorParams PARAMS = DetectorParams.of(Map.of(
            DetectorParams.MIN_SUPPORT, "50",
            StlMadDetector.PERIOD, "24",
            IsolationForestDetector.N_ESTIMATORS, "50"));

    static Stream<AnomalyDetector> detectors() {
        return Stream.of(
                new StlMadDetector(PARAMS),
                new CusumDetector(PARAMS),
                new IsolationForestDetector(PARAMS));
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void emptySeries_throwsEmptySeries(AnomalyDetector detector) {
        assertThatThrownBy(() -> detector.detect(MetricSeries.of()))
                .isInstanceOf(EmptySeriesException.class)
                .isInstanceOf(InsufficientDataException.class);
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void seriesShorterThanMinSupport_throwsInsufficientData(AnomalyDetector detector) {
        MetricSeries series = MetricSeries.of(TestDataFactory.gaussian(1L, 49, 100, 10));

        assertThatThrownBy(() -> detector.detect(series))
                .isInstanceOf(InsufficientDataException.class)
                .isNotInstanceOf(EmptySeriesException.class)
                .satisfies(e -> {
                    InsufficientDataException ex = (InsufficientDataException) e;
                    assertThat(ex.getLength()).isEqualTo(49);
                    assertThat(ex.getMinSupport()).isEqualTo(50);
                });
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void nanValue_throwsNonFiniteInput(AnomalyDetector detector) {
        double[] values = TestDataFactory.gaussian(2L, 80, 100, 10);
        values[17] = Double.NaN;

        assertThatThrownBy(() -> detector.detect(MetricSeries.of(values)))
                .isInstanceOf(NonFiniteInputException.class)
                .satisfies(e -> assertThat(((NonFiniteInputException) e).getIndex()).isEqualTo(17));
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void infiniteValue_throwsNonFiniteInput(AnomalyDetector detector) {
        double[] values = TestDataFactory.gaussian(3L, 80, 100, 10);
        values[79] = Double.POSITIVE_INFINITY;

        assertThatThrownBy(() -> detector.validate(MetricSeries.of(values)))
                .isInstanceOf(NonFiniteInputException.class);
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void result_hasOneFiniteScorePerPointAndSortedAnomalies(AnomalyDetector detector) {
        double[] values = TestDataFactory.gaussian(4L, 120, 100, 10);
        values[60] = 400;

        DetectorResult result = detector.detect(MetricSeries.of(values));

        assertThat(result.size()).isEqualTo(120);
        assertThat(Arrays.stream(result.getScores()).allMatch(Double::isFinite)).isTrue();
        assertThat(result.getAnomalies()).isSorted().doesNotHaveDuplicates();
        for (int i : result.getAnomalies()) {
            assertThat(i).isBetween(0, 119);
            assertThat(result.scoreAt(i)).isGreaterThan(detector.getK());
        }
        assertThat(result.getDetectorType()).isEqualTo(detector.type());
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void detect_doesNotMutateInput(AnomalyDetector detector) {
        double[] values = TestDataFactory.gaussian(5L, 100, 100, 10);
        MetricSeries series = MetricSeries.of(values);
        double[] before = series.primary();

        detector.detect(series);

        assertThat(series.primary()).containsExactly(before);
    }

    @ParameterizedTest
    @MethodSource("detectors")
    void commonParams_defaultWhenAbsent(AnomalyDetector detector) {
        assertThat(detector.getK()).isEqualTo(DetectorParams.DEFAULT_K);
        assertThat(detector.getPersistence()).isEqualTo(DetectorParams.DEFAULT_PERSISTENCE);
        assertThat(detector.getMinSupport()).isEqualTo(50);
    }
}
