package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Behavioural risk indicators")
public class RiskMetrics {

    @Schema(description = "Gambling spend as a percentage of weighted income", example = "0.0")
    double gamblingPercentage;

    @Schema(description = "Total gambling spend over the window", example = "0.0")
    double gamblingTotal;

    @Schema(description = "Failed payments in the last 45 days", example = "0")
    int failedPayments45d;

    @Schema(description = "Failed payments over the whole history", example = "0")
    int failedPaymentsAllTime;

    @Schema(description = "Bank charges in the last 90 days", example = "0")
    int bankCharges90d;

    @Schema(description = "Bank charges over the whole history", example = "0")
    int bankChargesAllTime;

    @Schema(description = "Distinct credit providers first seen in the last 90 days", example = "0")
    int newCreditProviders90d;
}
