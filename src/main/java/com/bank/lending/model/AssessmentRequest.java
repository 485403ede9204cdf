package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Loan application with the applicant's transaction history")
public class AssessmentRequest {

    @Schema(description = "Caller's reference for the application", example = "APP-000123")
    private String applicationRef;

    @Schema(description = "Requested principal; the configured default is used when absent", example = "500")
    private Double requestedAmount;

    @Schema(description = "Requested term in months; the configured default is used when absent", example = "4")
    private Integer requestedTermMonths;

    @Schema(description = "Current account balance, used to reconstruct historic balances", example = "350.0")
    private Double currentBalance;

    @Schema(description = "Transaction history")
    private List<Transaction> transactions;
}
