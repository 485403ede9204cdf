package com.bank.lending.model;

import lombok.Value;

/**
 * Answer of the behavioral income detector for one transaction.
 */
@Value
public class IncomeVerdict {

    boolean income;
    double confidence;
    String reason;

    /** Income subcategory suggested for the transaction; null when not income. */
    String subcategory;

    public static IncomeVerdict income(double confidence, String subcategory, String reason) {
        return new IncomeVerdict(true, confidence, reason, subcategory);
    }

    public static IncomeVerdict notIncome(double confidence, String reason) {
        return new IncomeVerdict(false, confidence, reason, null);
    }
}
