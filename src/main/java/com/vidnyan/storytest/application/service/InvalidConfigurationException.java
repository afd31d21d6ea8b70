package com.vidnyan.storytest.application.service;

import java.util.List;

/**
 * Raised before any walking starts when a {@link ValidationConfiguration} is unusable.
 */
public class InvalidConfigurationException extends IllegalArgumentException {

    private final List<String> problems;

    public InvalidConfigurationException(List<String> problems) {
        super("Invalid validation configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
