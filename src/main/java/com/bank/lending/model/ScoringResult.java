package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@Schema(description = "Decision, score and explanation for one application")
public class ScoringResult {

    @Schema(description = "Final decision", example = "APPROVE")
    Decision decision;

    @Schema(description = "Total score (0-100)", example = "82.0")
    double score;

    @Schema(description = "Risk level derived from the decision", example = "LOW")
    RiskLevel riskLevel;

    @Schema(description = "Per-component breakdown; absent when a decline rule stopped scoring")
    ScoreBreakdown breakdown;

    @Schema(description = "Results of every evaluated rule")
    List<RuleResult> ruleResults;

    @Schema(description = "Decline and refer reasons", example = "[\"Monthly income 1200.00 below minimum 1500.00\"]")
    List<String> reasons;

    @Schema(description = "Risk observations reported regardless of decision",
            example = "[\"Gambling activity: 3.2% of income\"]")
    List<String> riskFlags;

    @Schema(description = "Loan offer, present only when approved")
    LoanOffer offer;
}
