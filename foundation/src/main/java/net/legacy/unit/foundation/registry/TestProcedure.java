package net.legacy.unit.foundation.registry;

/**
 * The body of a registered test.
 *
 * <p>A procedure signals a failed check by throwing a
 * {@link net.legacy.unit.foundation.failure.TestFailureException}. Any other throwable is
 * classified by the runner as an unexpected or unrecognized error.
 *
 * @author qwq-dev
 * @since 2025-06-14 11:40
 */
@FunctionalInterface
public interface TestProcedure {
    /**
     * Runs the test body.
     *
     * @throws Throwable whatever the body throws
     */
    void run() throws Throwable;
}
