package net.littleredcomputer.boolsat;

import java.time.Duration;

/**
 * Thrown from a deadline-bounded {@link VariableSelector} to abandon a search that has run past
 * its time budget.
 */
public class SearchTimeoutException extends RuntimeException {
    private final Duration budget;

    public SearchTimeoutException(Duration budget, Duration elapsed) {
        super(String.format("search exceeded its budget of %s (elapsed %s)", budget, elapsed));
        this.budget = budget;
    }

    public Duration budget() { return budget; }
}
