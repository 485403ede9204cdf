package com.bank.lending.model;

public enum RiskLevel {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    VERY_HIGH,
    CRITICAL;

    public static RiskLevel fromDecision(Decision decision) {
        switch (decision) {
            case APPROVE:
                return LOW;
            case REFER:
                return HIGH;
            default:
                return VERY_HIGH;
        }
    }
}
