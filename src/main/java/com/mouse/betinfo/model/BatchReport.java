package com.mouse.betinfo.model;

import java.util.List;

/**
 * Result of a per-game batch: what each unit produced, and which units failed and why.
 * A failed unit never hides the others.
 */
public record BatchReport<T>(String operation, List<T> successes, List<String> skipped, List<UnitFailure> failures) {

    public BatchReport {
        successes = List.copyOf(successes);
        skipped = List.copyOf(skipped);
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public int attempted() {
        return successes.size() + skipped.size() + failures.size();
    }
}
