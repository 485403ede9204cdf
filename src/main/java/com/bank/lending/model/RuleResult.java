package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of a single decline or refer rule")
public class RuleResult {

    @Schema(description = "Rule type", example = "MAX_ACTIVE_HCSTC_LENDERS")
    DecisionRuleType ruleType;

    @Schema(description = "Rule display name", example = "Active high-cost lenders")
    String ruleName;

    @Schema(description = "Whether the rule fired", example = "true")
    boolean triggered;

    @Schema(description = "Action taken when the rule fires", example = "DECLINE")
    RuleAction action;

    @Schema(description = "Metric value the rule was evaluated against", example = "7")
    double observedValue;

    @Schema(description = "Configured threshold", example = "6")
    double threshold;

    @Schema(description = "Human-readable explanation",
            example = "Active high-cost lenders in last 90 days: 7 (maximum 6)")
    String reason;
}
