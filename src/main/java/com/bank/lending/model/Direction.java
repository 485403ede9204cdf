package com.bank.lending.model;

/**
 * Money flow of a transaction. Negative amounts are credits, positive amounts are debits.
 */
public enum Direction {
    CREDIT,
    DEBIT,
    ANY;

    public boolean accepts(Direction actual) {
        return this == ANY || this == actual;
    }
}
