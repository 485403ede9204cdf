package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "All metrics derived from an applicant's classified transactions")
public class MetricsBundle {

    @Schema(description = "Calendar months of data used as the monthly divisor", example = "3")
    int monthsOfData;

    IncomeMetrics income;
    ExpenseMetrics expense;
    DebtMetrics debt;
    AffordabilityMetrics affordability;
    BalanceMetrics balance;
    RiskMetrics risk;
}
