package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Affordability figures for the requested loan")
public class AffordabilityMetrics {

    @Schema(description = "Income minus essentials minus debt, per month", example = "1300.0")
    double monthlyDisposable;

    @Schema(description = "Disposable income with the expense shock buffer applied to essentials", example = "1205.0")
    double stressedDisposable;

    @Schema(description = "Monthly repayment for the requested loan", example = "166.4")
    double proposedRepayment;

    @Schema(description = "Stressed disposable income after the proposed repayment", example = "1038.6")
    double postLoanDisposable;

    @Schema(description = "Existing debt repayments as a percentage of income", example = "10.0")
    double debtToIncomeRatio;

    @Schema(description = "Debt repayments including the proposed loan as a percentage of income", example = "16.7")
    double projectedDebtToIncomeRatio;

    @Schema(description = "Largest principal affordable over the requested term", example = "1500.0")
    double maxAffordableAmount;
}
