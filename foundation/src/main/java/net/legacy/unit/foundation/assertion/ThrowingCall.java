package net.legacy.unit.foundation.assertion;

/**
 * A call checked by {@link TestAssertions#assertException} and {@link TestAssertions#assertNoException}.
 *
 * @author qwq-dev
 * @since 2025-06-14 11:10
 */
@FunctionalInterface
public interface ThrowingCall {
    /**
     * Performs the call.
     *
     * @throws Exception whatever the call throws
     */
    void call() throws Exception;
}
