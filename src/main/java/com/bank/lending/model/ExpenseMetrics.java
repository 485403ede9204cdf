package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Monthly expense metrics")
public class ExpenseMetrics {

    @Schema(description = "Essential spend per month (housing counted once)", example = "950.0")
    double monthlyEssential;

    @Schema(description = "Housing cost per month (greater of rent and mortgage)", example = "700.0")
    double monthlyHousing;

    @Schema(description = "Discretionary and unclassified spend per month", example = "400.0")
    double monthlyDiscretionary;
}
