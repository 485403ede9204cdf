package com.bank.lending.model;

public enum Decision {
    APPROVE,
    REFER,
    DECLINE
}
