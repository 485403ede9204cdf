package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Existing credit commitments")
public class DebtMetrics {

    @Schema(description = "Debt repayments per month", example = "250.0")
    double monthlyDebtPayments;

    @Schema(description = "High-cost short-term credit repayments per month", example = "0.0")
    double monthlyHcstcPayments;

    @Schema(description = "Distinct high-cost lenders repaid in the last 90 days", example = "1")
    int activeHcstcLenders90d;

    @Schema(description = "Distinct high-cost lenders repaid over the whole history", example = "2")
    int activeHcstcLendersAllTime;

    @Schema(description = "Distinct debt collection agencies", example = "0")
    int debtCollectionAgencies;
}
