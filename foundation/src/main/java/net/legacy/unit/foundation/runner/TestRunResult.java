package net.legacy.unit.foundation.runner;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Summary of one test run.
 *
 * @author qwq-dev
 * @version 1.1
 * @since 2025-06-07 22:30
 */
@Value
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TestRunResult {

    /**
     * The number of registered tests that were executed.
     */
    int total;

    /**
     * The failure records, in execution order.
     */
    @Singular
    List<FailureRecord> failures;

    /**
     * Run duration in milliseconds.
     */
    long durationMs;

    /**
     * Gets the number of tests that passed.
     *
     * @return the passed count
     */
    public int getPassed() {
        return total - failures.size();
    }

    /**
     * Gets the number of tests that did not pass.
     *
     * @return the failed count
     */
    public int getFailed() {
        return failures.size();
    }

    /**
     * Whether every executed test passed.
     *
     * @return true if there is no failure record
     */
    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
