package com.fraud.analytics.calibration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationReport {
    private Double predictedRisk;
    private Double brierScore;
    private Double logLoss;
    private int labelledCount;
    private int fraudCount;
    private Double prevalence;
    private double riskThreshold;
    private List<DailyConfusion> daily;
}
