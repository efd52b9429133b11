package com.fraud.analytics.calibration;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Confusion matrix of one UTC day. A null cell means no occurrences, as opposed to no data.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyConfusion {

    private LocalDate date;

    @Schema(description = "Transactions whose event time falls on this day")
    private int count;

    private Integer tp;
    private Integer fp;
    private Integer tn;
    private Integer fn;
}
