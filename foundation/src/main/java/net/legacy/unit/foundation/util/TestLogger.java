package net.legacy.unit.foundation.util;

import lombok.experimental.UtilityClass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Standardized diagnostic logging for the harness.
 *
 * <p>All messages share a {@code [TEST] [<module>]} prefix so harness diagnostics are easy to
 * separate from the output of the code under test. Logging never goes to the report stream.
 *
 * @author qwq-dev
 * @version 1.1
 * @since 2025-06-07 22:30
 */
@UtilityClass
public class TestLogger {
    private static final Logger LOGGER = LoggerFactory.getLogger("net.legacy.unit");
    private static final String TEST_PREFIX = "[TEST]";

    /**
     * Logs a test start message.
     *
     * @param moduleName the name of the harness part logging
     * @param testName   the name of the test being started
     */
    public static void logTestStart(String moduleName, String testName) {
        logDebug(moduleName, "Starting test: %s", testName);
    }

    /**
     * Logs a test completion message.
     *
     * @param moduleName the name of the harness part logging
     * @param testName   the name of the test that completed
     * @param outcome    the outcome label
     * @param durationMs the test duration in milliseconds
     * @param verbose    whether to log at info instead of debug
     */
    public static void logTestComplete(String moduleName, String testName, String outcome,
                                       long durationMs, boolean verbose) {
        if (verbose) {
            logInfo(moduleName, "Test completed: %s -> %s (took %dms)", testName, outcome, durationMs);
        } else {
            logDebug(moduleName, "Test completed: %s -> %s (took %dms)", testName, outcome, durationMs);
        }
    }

    /**
     * Logs a test failure message.
     *
     * @param moduleName the name of the harness part logging
     * @param message    the failure message
     * @param replace    format arguments for message string formatting
     */
    public static void logFailure(String moduleName, String message, Object... replace) {
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn("{} [{}] {}", TEST_PREFIX, moduleName, String.format(message, replace));
        }
    }

    /**
     * Logs a test failure message with exception details.
     *
     * @param moduleName the name of the harness part logging
     * @param message    the failure message
     * @param throwable  the throwable that caused the failure
     * @param replace    format arguments for message string formatting
     */
    public static void logFailure(String moduleName, String message, Throwable throwable, Object... replace) {
        if (LOGGER.isErrorEnabled()) {
            LOGGER.error("{} [{}] {}", TEST_PREFIX, moduleName, String.format(message, replace), throwable);
        }
    }

    /**
     * Logs general harness information.
     *
     * @param moduleName the name of the harness part logging
     * @param message    the information message
     * @param replace    format arguments for message string formatting
     */
    public static void logInfo(String moduleName, String message, Object... replace) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("{} [{}] {}", TEST_PREFIX, moduleName, String.format(message, replace));
        }
    }

    /**
     * Logs a warning.
     *
     * @param moduleName the name of the harness part logging
     * @param message    the warning message
     * @param replace    format arguments for message string formatting
     */
    public static void logWarning(String moduleName, String message, Object... replace) {
        if (LOGGER.isWarnEnabled()) {
            LOGGER.warn("{} [{}] {}", TEST_PREFIX, moduleName, String.format(message, replace));
        }
    }

    /**
     * Logs a debug message.
     *
     * @param moduleName the name of the harness part logging
     * @param message    the debug message
     * @param replace    format arguments for message string formatting
     */
    public static void logDebug(String moduleName, String message, Object... replace) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("{} [{}] [DEBUG] {}", TEST_PREFIX, moduleName, String.format(message, replace));
        }
    }

    /**
     * Logs run statistics.
     *
     * @param moduleName   the name of the harness part logging
     * @param totalTests   the total number of tests
     * @param successCount the number of passed tests
     * @param failureCount the number of tests that did not pass
     * @param durationMs   the total run duration in milliseconds
     */
    public static void logStatistics(String moduleName, int totalTests, int successCount,
                                     int failureCount, long durationMs) {
        logInfo(moduleName, "Statistics: Total=%d, Success=%d, Failed=%d, Duration=%dms",
                totalTests, successCount, failureCount, durationMs);
    }
}
