package com.bank.lending.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A cluster of credits with near-equal amounts arriving on a regular cadence.
 * Computed per classification run; never persisted.
 */
@Value
@Builder
public class RecurringIncomeSource {

    /** Indexes (into the analysed transaction list) of the member credits, in date order. */
    List<Integer> transactionIndexes;

    double averageAmount;

    /** Largest relative deviation of a member amount from the average. */
    double amountSpread;

    FrequencyBand band;

    double averageIntervalDays;

    boolean dayOfMonthConsistent;

    double confidence;

    public int getOccurrences() {
        return transactionIndexes.size();
    }
}
