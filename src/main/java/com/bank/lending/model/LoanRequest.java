package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Value;

@Value
@Schema(description = "Principal and term requested by the applicant")
public class LoanRequest {

    @Schema(description = "Requested principal", example = "500")
    double amount;

    @Schema(description = "Requested term in months", example = "4")
    int termMonths;
}
