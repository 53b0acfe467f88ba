package com.vdbfuzz.config;

import java.util.List;

/**
 * Invalid run configuration. The only error that aborts a run before any test case is issued.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /** Individual validation problems, at least one. */
    public List<String> getProblems() {
        return problems;
    }
}
