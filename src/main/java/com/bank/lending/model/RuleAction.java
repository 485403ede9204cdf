package com.bank.lending.model;

/**
 * Outcome forced by a policy rule when it fires.
 */
public enum RuleAction {
    DECLINE,
    REFER
}
