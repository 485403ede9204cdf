package com.bank.lending.model;

/**
 * Top-level semantic category assigned to every classified transaction.
 */
public enum Category {
    INCOME,
    DEBT,
    ESSENTIAL,
    EXPENSE,
    RISK,
    TRANSFER,
    POSITIVE,
    OTHER
}
