package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Income metrics over the lookback window, expressed per month")
public class IncomeMetrics {

    @Schema(description = "Weighted monthly income", example = "2500.0")
    double monthlyIncome;

    @Schema(description = "Monthly income from salary, benefits and pension", example = "2500.0")
    double monthlyStableIncome;

    @Schema(description = "Weighted monthly gig-economy income", example = "0.0")
    double monthlyGigIncome;

    @Schema(description = "Weighted monthly income from other sources", example = "0.0")
    double monthlyOtherIncome;

    @Schema(description = "100 minus the coefficient of variation of monthly income (0-100)", example = "100.0")
    double stabilityScore;

    @Schema(description = "Consistency of income payment day of month (0-100)", example = "100.0")
    double regularityScore;

    @Schema(description = "Whether stable income with non-zero weight was observed", example = "true")
    boolean verified;
}
