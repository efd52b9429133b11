package com.fraud.analytics.calibration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A transaction with its investigated outcome and the risk the model predicted for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoredTransaction {

    private String txId;

    private Instant eventTs;

    // FRAUD / NOT_FRAUD, 1 / 0 or true / false; anything else counts as unlabelled.
    private Object actualOutcome;

    private Double predictedRisk;
}
