package com.bank.lending.engine.decision;

import com.bank.lending.config.ProductConfig;
import com.bank.lending.model.LoanOffer;
import org.springframework.stereotype.Component;

/**
 * Loan pricing under a daily simple-interest rate with a total cost cap.
 * Interest = min(P x monthly rate x term, P x cap); repayments are level.
 */
@Component
public class RepaymentCalculator {

    private final ProductConfig product;

    public RepaymentCalculator(ProductConfig product) {
        this.product = product;
    }

    public double totalInterest(double principal, int termMonths) {
        if (principal <= 0 || termMonths <= 0) {
            return 0.0;
        }
        return Math.min(principal * product.monthlyInterestRate() * termMonths,
                principal * product.getTotalCostCap());
    }

    public double monthlyRepayment(double principal, int termMonths) {
        if (principal <= 0 || termMonths <= 0) {
            return 0.0;
        }
        return (principal + totalInterest(principal, termMonths)) / termMonths;
    }

    /**
     * Largest principal whose repayment leaves the minimum buffer out of the given
     * disposable income, capped at the product maximum and never negative.
     */
    public double maxAffordablePrincipal(double disposable, int termMonths) {
        double maxMonthlyPayment = disposable - product.getMinDisposableBuffer();
        if (maxMonthlyPayment <= 0 || termMonths <= 0) {
            return 0.0;
        }
        double interestFactor = Math.min(1 + product.monthlyInterestRate() * termMonths,
                1 + product.getTotalCostCap());
        double maxAmount = maxMonthlyPayment * termMonths / interestFactor;
        return Math.max(0.0, Math.min(maxAmount, product.getMaxLoanAmount()));
    }

    // Simplified annualised cost for display only
    public double indicativeApr(double principal, int termMonths) {
        if (principal <= 0 || termMonths <= 0) {
            return 0.0;
        }
        return totalInterest(principal, termMonths) / principal * (12.0 / termMonths) * 100;
    }

    public LoanOffer offer(double principal, int termMonths) {
        if (principal <= 0) {
            return LoanOffer.none(termMonths, product.getDailyInterestRate());
        }
        double monthly = monthlyRepayment(principal, termMonths);
        return LoanOffer.builder()
                .principal(round(principal, 2))
                .termMonths(termMonths)
                .monthlyRepayment(round(monthly, 2))
                .totalRepayable(round(principal + totalInterest(principal, termMonths), 2))
                .indicativeApr(round(indicativeApr(principal, termMonths), 1))
                .dailyInterestRate(product.getDailyInterestRate())
                .build();
    }

    static double round(double value, int places) {
        double factor = Math.pow(10, places);
        return Math.round(value * factor) / factor;
    }
}
