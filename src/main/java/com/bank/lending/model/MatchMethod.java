package com.bank.lending.model;

public enum MatchMethod {
    KEYWORD,
    REGEX,
    FUZZY,
    TAXONOMY_STRICT,
    TAXONOMY_FALLBACK,
    BEHAVIORAL,
    DEFAULT
}
