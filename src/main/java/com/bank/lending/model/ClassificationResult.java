package com.bank.lending.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@Schema(description = "Classification outcome for a single transaction")
public class ClassificationResult {

    @Schema(description = "Top-level category", example = "INCOME")
    Category category;

    @Schema(description = "Subcategory within the category", example = "salary")
    String subcategory;

    @Schema(description = "Confidence of the classification (0-1)", example = "0.95")
    double confidence;

    @Schema(description = "How the match was made", example = "BEHAVIORAL")
    MatchMethod method;

    @Schema(description = "Pipeline step that produced the result", example = "BEHAVIORAL")
    ClassificationStep step;

    @Schema(description = "Income weight (0 excludes from income, <1 discounts unstable income, 1 for expenses)", example = "1.0")
    double weight;

    @Schema(description = "Whether the income source is considered stable", example = "true")
    boolean stable;

    @Schema(description = "Risk level carried by the category", example = "NONE")
    RiskLevel riskLevel;

    @Schema(description = "Whether the transaction is a housing cost (rent or mortgage)", example = "false")
    boolean housing;

    @Schema(description = "Canonical high-cost lender identifier, when one was recognised", example = "LENDING_STREAM")
    String lenderId;

    @Schema(description = "Keyword, pattern or taxonomy code that matched", example = "BANK GIRO CREDIT")
    String matchedPattern;

    @Schema(description = "Human-readable explanation", example = "Payroll keyword: BANK GIRO CREDIT")
    String reason;

    @JsonIgnore
    public boolean isIncome() {
        return category == Category.INCOME;
    }
}
