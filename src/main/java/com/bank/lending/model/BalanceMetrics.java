package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Account balance behaviour reconstructed from the current balance")
public class BalanceMetrics {

    @Schema(description = "Average end-of-day balance", example = "640.0")
    double averageBalance;

    @Schema(description = "Lowest end-of-day balance", example = "-120.0")
    double minimumBalance;

    @Schema(description = "Days ending with a negative balance", example = "3")
    int daysInOverdraft;

    @Schema(description = "Times the balance moved from non-negative to negative", example = "1")
    int overdraftEntries;
}
