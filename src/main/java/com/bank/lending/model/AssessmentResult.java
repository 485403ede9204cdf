package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Full assessment of one application, including the audit trail")
public class AssessmentResult {

    @Schema(description = "Caller's reference for the application", example = "APP-000123")
    String applicationRef;

    ScoringResult scoring;

    MetricsBundle metrics;

    @Schema(description = "Classification of every submitted transaction")
    List<ClassifiedTransaction> classifications;

    @Schema(description = "Calendar months of data used as the monthly divisor", example = "3")
    int monthsOfData;

    @Schema(description = "Assessment timestamp in epoch milliseconds", example = "1739886764000")
    long assessedAt;
}
