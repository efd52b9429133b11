package com.fraud.analytics.calibration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores the quality of risk predictions against investigated outcomes.
 */
@Service
public class CalibrationEvaluator {

    private static final Logger log = LoggerFactory.getLogger(CalibrationEvaluator.class);

    public static final double DEFAULT_RISK_THRESHOLD = 0.7;
    static final double CLIP_EPSILON = 1e-15;

    /**
     * Mean squared error between a constant predicted risk and each labelled outcome.
     * Null when the risk is null or not finite, or no transaction carries a recognised label.
     */
    public Double brierScore(Collection<ScoredTransaction> transactions, Double predictedRisk) {
        if (!isUsableRisk(predictedRisk) || transactions == null) return null;

        double sum = 0.0;
        int labelled = 0;
        for (ScoredTransaction txn : transactions) {
            Double outcome = OutcomeLabels.binarize(txn.getActualOutcome());
            if (outcome == null) continue;
            double diff = predictedRisk - outcome;
            sum += diff * diff;
            labelled++;
        }
        return labelled == 0 ? null : sum / labelled;
    }

    /**
     * Cross-entropy of a constant predicted risk, clipped away from 0 and 1 so the result stays finite.
     */
    public Double logLoss(Collection<ScoredTransaction> transactions, Double predictedRisk) {
        if (!isUsableRisk(predictedRisk) || transactions == null) return null;

        double p = Math.min(Math.max(predictedRisk, CLIP_EPSILON), 1.0 - CLIP_EPSILON);
        double sum = 0.0;
        int labelled = 0;
        for (ScoredTransaction txn : transactions) {
            Double outcome = OutcomeLabels.binarize(txn.getActualOutcome());
            if (outcome == null) continue;
            sum += -(outcome * Math.log(p) + (1.0 - outcome) * Math.log(1.0 - p));
            labelled++;
        }
        return labelled == 0 ? null : sum / labelled;
    }

    public List<DailyConfusion> dailyConfusionTimeseries(Collection<ScoredTransaction> transactions,
                                                         Instant windowStart, Instant windowEnd) {
        return dailyConfusionTimeseries(transactions, windowStart, windowEnd, DEFAULT_RISK_THRESHOLD);
    }

    /**
     * One entry per UTC day from windowStart's date to windowEnd's date inclusive, including days
     * without transactions. Labelled transactions with a predicted risk are positive when
     * {@code predictedRisk >= riskThreshold}.
     */
    public List<DailyConfusion> dailyConfusionTimeseries(Collection<ScoredTransaction> transactions,
                                                         Instant windowStart, Instant windowEnd,
                                                         double riskThreshold) {
        if (windowStart == null || windowEnd == null) {
            throw new IllegalArgumentException("windowStart and windowEnd are required");
        }
        LocalDate firstDay = windowStart.atZone(ZoneOffset.UTC).toLocalDate();
        LocalDate lastDay = windowEnd.atZone(ZoneOffset.UTC).toLocalDate();
        if (lastDay.isBefore(firstDay)) {
            throw new IllegalArgumentException("windowEnd " + windowEnd + " is before windowStart " + windowStart);
        }

        // date -> [count, tp, fp, tn, fn]
        Map<LocalDate, int[]> perDay = new HashMap<>();
        int skipped = 0;
        if (transactions != null) {
            for (ScoredTransaction txn : transactions) {
                if (txn.getEventTs() == null) {
                    skipped++;
                    continue;
                }
                LocalDate day = txn.getEventTs().atZone(ZoneOffset.UTC).toLocalDate();
                if (day.isBefore(firstDay) || day.isAfter(lastDay)) continue;

                int[] counts = perDay.computeIfAbsent(day, d -> new int[5]);
                counts[0]++;

                Double outcome = OutcomeLabels.binarize(txn.getActualOutcome());
                Double risk = txn.getPredictedRisk();
                if (outcome == null || risk == null || !Double.isFinite(risk)) continue;

                boolean predictedFraud = risk >= riskThreshold;
                boolean actualFraud = outcome == 1.0;
                if (predictedFraud && actualFraud) counts[1]++;
                else if (predictedFraud) counts[2]++;
                else if (!actualFraud) counts[3]++;
                else counts[4]++;
            }
        }
        if (skipped > 0) {
            log.debug("Ignored {} transactions without an event timestamp", skipped);
        }

        List<DailyConfusion> series = new ArrayList<>();
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) {
            int[] counts = perDay.getOrDefault(day, new int[5]);
            series.add(DailyConfusion.builder()
                    .date(day)
                    .count(counts[0])
                    .tp(cell(counts[1]))
                    .fp(cell(counts[2]))
                    .tn(cell(counts[3]))
                    .fn(cell(counts[4]))
                    .build());
        }
        return series;
    }

    /**
     * Brier score, log loss, prevalence and the daily confusion series in one report.
     */
    public CalibrationReport evaluate(Collection<ScoredTransaction> transactions, Double predictedRisk,
                                      Instant windowStart, Instant windowEnd, double riskThreshold) {
        int labelled = 0;
        int fraud = 0;
        if (transactions != null) {
            for (ScoredTransaction txn : transactions) {
                Double outcome = OutcomeLabels.binarize(txn.getActualOutcome());
                if (outcome == null) continue;
                labelled++;
                if (outcome == 1.0) fraud++;
            }
        }

        CalibrationReport report = CalibrationReport.builder()
                .predictedRisk(predictedRisk)
                .brierScore(brierScore(transactions, predictedRisk))
                .logLoss(logLoss(transactions, predictedRisk))
                .labelledCount(labelled)
                .fraudCount(fraud)
                .prevalence(labelled == 0 ? null : (double) fraud / labelled)
                .riskThreshold(riskThreshold)
                .daily(dailyConfusionTimeseries(transactions, windowStart, windowEnd, riskThreshold))
                .build();

        log.info("Calibration evaluated: labelled={}, fraud={}, brier={}, logLoss={}",
                labelled, fraud, report.getBrierScore(), report.getLogLoss());
        return report;
    }

    private static Integer cell(int count) {
        return count == 0 ? null : count;
    }

    private static boolean isUsableRisk(Double risk) {
        return risk != null && Double.isFinite(risk);
    }
}
