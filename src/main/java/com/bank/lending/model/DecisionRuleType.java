package com.bank.lending.model;

/**
 * Policy rules in their fixed evaluation order.
 */
public enum DecisionRuleType {
    MIN_MONTHLY_INCOME,
    NO_VERIFIABLE_INCOME,
    MAX_ACTIVE_HCSTC_LENDERS,
    MAX_GAMBLING_PERCENTAGE,
    MIN_POST_LOAN_DISPOSABLE,
    MAX_FAILED_PAYMENTS,
    MAX_DCA_COUNT,
    MAX_DTI_WITH_NEW_LOAN,
    BANK_CHARGES_REFERRAL,
    NEW_CREDIT_BURST_REFERRAL
}
