package com.bank.lending.config;

import java.util.List;

/**
 * Raised at start-up when engine configuration is missing or inconsistent.
 * Carries every problem found so they can be fixed in one pass.
 */
public class EngineConfigurationException extends RuntimeException {

    private final List<String> problems;

    public EngineConfigurationException(List<String> problems) {
        super("Invalid engine configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public EngineConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
