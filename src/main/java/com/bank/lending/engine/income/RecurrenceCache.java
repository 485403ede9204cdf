package com.bank.lending.engine.income;

import com.bank.lending.model.RecurringIncomeSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recurring income sources found in one applicant's transactions, with an index
 * for constant-time membership lookups. Owned by a single classification run
 * and discarded with it; never shared between applicants or threads.
 */
public class RecurrenceCache {

    private static final RecurrenceCache EMPTY = new RecurrenceCache(List.of());

    private final List<RecurringIncomeSource> sources;
    private final Map<Integer, RecurringIncomeSource> byTransactionIndex = new HashMap<>();

    public RecurrenceCache(List<RecurringIncomeSource> sources) {
        this.sources = List.copyOf(sources);
        for (RecurringIncomeSource source : this.sources) {
            for (Integer index : source.getTransactionIndexes()) {
                byTransactionIndex.put(index, source);
            }
        }
    }

    public static RecurrenceCache empty() {
        return EMPTY;
    }

    public Optional<RecurringIncomeSource> sourceFor(int transactionIndex) {
        return Optional.ofNullable(byTransactionIndex.get(transactionIndex));
    }

    public List<RecurringIncomeSource> getSources() {
        return Collections.unmodifiableList(sources);
    }
}
