package com.bank.lending.model;

public enum ComponentType {
    AFFORDABILITY,
    INCOME_QUALITY,
    ACCOUNT_CONDUCT,
    RISK_INDICATORS
}
