package com.bank.lending.engine.classification;

import com.bank.lending.engine.income.RecurrenceCache;
import com.bank.lending.model.Transaction;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a matcher may look at for one transaction. Built once per transaction
 * by the {@link TransactionClassifier}.
 */
@Value
@Builder
public class ClassificationContext {

    /** Position in the analysed list, used for recurrence lookups. */
    int index;

    Transaction transaction;

    /** Normalized description and merchant name, lenders canonicalized. */
    String text;

    /** Canonical lender id found in the text, or null. */
    String lenderId;

    RecurrenceCache recurrence;

    public boolean isCredit() {
        return transaction.isCredit();
    }

    public String taxonomyDetailed() {
        return upper(transaction.getTaxonomyDetailed());
    }

    public String taxonomyPrimary() {
        return upper(transaction.getTaxonomyPrimary());
    }

    private static String upper(String value) {
        return value == null ? "" : value.trim().toUpperCase();
    }
}
