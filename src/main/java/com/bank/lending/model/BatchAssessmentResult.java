package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Results and statistics for a batch of applications")
public class BatchAssessmentResult {

    @Schema(description = "Applications submitted", example = "10")
    int totalApplications;

    @Schema(description = "Successful assessments, in submission order")
    List<AssessmentResult> results;

    @Schema(description = "Applications that could not be assessed")
    List<BatchError> errors;

    @Schema(description = "Number of results per decision", example = "{\"APPROVE\": 6, \"REFER\": 3, \"DECLINE\": 1}")
    Map<Decision, Integer> decisionCounts;

    @Schema(description = "Average score across successful assessments", example = "64.2")
    double averageScore;

    @Schema(description = "Lowest score", example = "0.0")
    double minScore;

    @Schema(description = "Highest score", example = "91.0")
    double maxScore;

    @Schema(description = "Wall-clock time for the batch in milliseconds", example = "182")
    long elapsedMillis;
}
