package com.bank.lending.model;

/**
 * Steps of the classification chain, in evaluation order.
 * The declaration order is the order in which matchers run.
 */
public enum ClassificationStep {
    STRICT_TAXONOMY,
    WHITELIST,
    BEHAVIORAL,
    PATTERN_TABLE,
    FALLBACK
}
