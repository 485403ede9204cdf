package com.bank.lending.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Loan offer for an approved application. A zero principal means no offer could be made.")
public class LoanOffer {

    @Schema(description = "Approved principal", example = "500.0")
    double principal;

    @Schema(description = "Approved term in months", example = "4")
    int termMonths;

    @Schema(description = "Monthly repayment", example = "185.8")
    double monthlyRepayment;

    @Schema(description = "Total amount repayable", example = "743.2")
    double totalRepayable;

    @Schema(description = "Indicative annual percentage rate (simple, not compounded)", example = "291.84")
    double indicativeApr;

    @Schema(description = "Daily interest rate", example = "0.008")
    double dailyInterestRate;

    public static LoanOffer none(int termMonths, double dailyInterestRate) {
        return LoanOffer.builder()
                .principal(0.0)
                .termMonths(termMonths)
                .dailyInterestRate(dailyInterestRate)
                .build();
    }
}
