package com.bank.lending.model;

public enum FrequencyBand {
    WEEKLY,
    FORTNIGHTLY,
    MONTHLY,
    QUARTERLY
}
