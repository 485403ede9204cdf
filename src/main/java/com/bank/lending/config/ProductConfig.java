package com.bank.lending.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loan product limits and pricing. The limits have no built-in defaults:
 * they must be configured, and start-up fails if any is missing.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "product")
public class ProductConfig {

    private Double minLoanAmount;
    private Double maxLoanAmount;
    private List<Integer> availableTerms;

    // Simple interest per day, e.g. 0.008 = 0.8%
    private Double dailyInterestRate;

    // Total interest may not exceed this fraction of principal
    private Double totalCostCap;

    // Post-loan disposable income that must remain when sizing the affordable principal
    private double minDisposableBuffer = 50.0;

    // Multiplier applied to essential spend for the stress-tested disposable figure
    private double expenseShockBuffer = 1.1;

    private double daysPerMonth = 30.4;

    public double monthlyInterestRate() {
        return dailyInterestRate * daysPerMonth;
    }

    public ProductConfig copy() {
        ProductConfig copy = new ProductConfig();
        copy.setMinLoanAmount(minLoanAmount);
        copy.setMaxLoanAmount(maxLoanAmount);
        copy.setAvailableTerms(availableTerms == null ? null
                : Collections.unmodifiableList(new ArrayList<>(availableTerms)));
        copy.setDailyInterestRate(dailyInterestRate);
        copy.setTotalCostCap(totalCostCap);
        copy.setMinDisposableBuffer(minDisposableBuffer);
        copy.setExpenseShockBuffer(expenseShockBuffer);
        copy.setDaysPerMonth(daysPerMonth);
        return copy;
    }
}
