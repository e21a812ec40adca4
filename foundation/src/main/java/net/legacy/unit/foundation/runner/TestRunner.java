package net.legacy.unit.foundation.runner;

import lombok.Getter;
import net.legacy.unit.foundation.failure.TestFailureException;
import net.legacy.unit.foundation.registry.TestEntry;
import net.legacy.unit.foundation.registry.TestRegistry;
import net.legacy.unit.foundation.terminal.Ansi;
import net.legacy.unit.foundation.terminal.AnsiStyle;
import net.legacy.unit.foundation.util.TestLogger;
import net.legacy.unit.foundation.util.TestTimer;
import net.legacy.unit.foundation.util.ValidationUtil;

import java.io.PrintStream;

/**
 * Executes every test of a {@link TestRegistry} and prints the report.
 *
 * <p>Tests run one at a time, in name order, each inside its own failure boundary so that
 * nothing a test throws can abort the remaining tests. Every outcome is classified as:
 * <ol>
 *   <li>{@link TestOutcome#PASS} if the procedure returns normally,</li>
 *   <li>{@link TestOutcome#FAIL} if it throws a {@link TestFailureException},</li>
 *   <li>{@link TestOutcome#EXCEPTION} if it throws any other {@link Exception},</li>
 *   <li>{@link TestOutcome#UNRECOGNIZED_EXCEPTION} for every other {@link Throwable}.</li>
 * </ol>
 *
 * <p>The report looks like this (escape sequences omitted):
 * <pre>
 * Running test "alpha" . . . PASS
 * Running test "beta" . . . FAIL
 *
 * - - - Failures - - -
 *  -&gt; [beta] Line 10: Expected TRUE, but was FALSE: "false"
 *
 * Total passed: [1 / 2]
 * </pre>
 *
 * <p>Lines always end with {@code \n}. There is no timeout: a test that never returns
 * blocks the run.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 13:00
 */
public class TestRunner {
    private static final String MODULE_NAME = "runner";
    private static final String NEW_LINE = "\n";
    private static final String UNEXPECTED_EXCEPTION_PREFIX = "Unexpected exception: ";
    private static final String UNKNOWN_ERROR_MESSAGE = "Totally unknown error was thrown!";
    private static final String RUN_TIMER = "run";
    private static final String TEST_TIMER_PREFIX = "test:";

    private final PrintStream out;

    @Getter
    private final RunnerSettings settings;

    /**
     * Creates a runner printing to {@link System#out} with the default settings.
     */
    public TestRunner() {
        this(System.out, RunnerSettings.defaults());
    }

    /**
     * Creates a runner.
     *
     * @param out      the stream receiving the report
     * @param settings the runner settings
     */
    public TestRunner(PrintStream out, RunnerSettings settings) {
        this.out = ValidationUtil.requireNonNull(out, "output stream cannot be null");
        this.settings = ValidationUtil.requireNonNull(settings, "settings cannot be null");
    }

    /**
     * Runs every test and returns the status code of the run.
     *
     * <p>With the default settings the status code is always
     * {@value RunnerSettings#STATUS_SUCCESS}; see {@link RunnerSettings#isFailOnError()}.
     *
     * @param registry the tests to run
     * @return the status code
     */
    public int run(TestRegistry registry) {
        return settings.statusCodeOf(runTests(registry));
    }

    /**
     * Runs every test, prints the report and returns the summary.
     *
     * @param registry the tests to run
     * @return the run summary
     */
    public TestRunResult runTests(TestRegistry registry) {
        ValidationUtil.requireNonNull(registry, "registry cannot be null");

        TestTimer timer = new TestTimer();
        timer.startTimer(RUN_TIMER);
        TestLogger.logInfo(MODULE_NAME, "Running %d test(s)...", registry.size());

        TestRunResult.TestRunResultBuilder result = TestRunResult.builder().total(registry.size());

        for (TestEntry entry : registry.getEntries()) {
            FailureRecord failure = runTest(entry, timer);
            if (failure != null) {
                result.failure(failure);
            }
        }

        TestRunResult summary = result.durationMs(timer.stopTimer(RUN_TIMER)).build();
        printSummary(summary);

        TestLogger.logStatistics(MODULE_NAME, summary.getTotal(), summary.getPassed(),
                summary.getFailed(), summary.getDurationMs());
        return summary;
    }

    /**
     * Runs a single test inside its failure boundary.
     *
     * @return the failure record, or null if the test passed
     */
    private FailureRecord runTest(TestEntry entry, TestTimer timer) {
        String name = entry.getName();
        out.print("Running test \"" + name + "\" . . . ");
        out.flush();

        TestLogger.logTestStart(MODULE_NAME, name);
        timer.startTimer(TEST_TIMER_PREFIX + name);

        TestOutcome outcome;
        String message = null;

        try {
            entry.getProcedure().run();
            outcome = TestOutcome.PASS;
        } catch (TestFailureException failure) {
            outcome = TestOutcome.FAIL;
            message = failure.render(settings.isColorOutput());
            TestLogger.logFailure(MODULE_NAME, "%s failed: %s", name, failure.getMessage());
        } catch (Exception exception) {
            if (exception instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }

            outcome = TestOutcome.EXCEPTION;
            message = UNEXPECTED_EXCEPTION_PREFIX + describe(exception);
            logThrown(name, "an unexpected exception", exception);
        } catch (Throwable throwable) {
            outcome = TestOutcome.UNRECOGNIZED_EXCEPTION;
            message = UNKNOWN_ERROR_MESSAGE;
            logThrown(name, "an unrecognized throwable", throwable);
        }

        printOutcome(outcome);
        TestLogger.logTestComplete(MODULE_NAME, name, outcome.getLabel(), timer.stopTimer(TEST_TIMER_PREFIX + name),
                settings.isVerboseLogging());

        return outcome == TestOutcome.PASS ? null : new FailureRecord(name, outcome, message);
    }

    /**
     * Renders an exception for the failures section.
     *
     * <p>Falls back to the class name if the exception cannot render itself.
     */
    private static String describe(Exception exception) {
        try {
            return exception.toString();
        } catch (Exception renderFailure) {
            return exception.getClass().getName();
        }
    }

    /**
     * Logs what a test threw, without the stack trace if the throwable cannot render itself.
     */
    private static void logThrown(String name, String kind, Throwable thrown) {
        try {
            TestLogger.logFailure(MODULE_NAME, "%s threw %s", thrown, name, kind);
        } catch (Exception renderFailure) {
            TestLogger.logFailure(MODULE_NAME, "%s threw %s of type %s, which could not be rendered: %s",
                    name, kind, thrown.getClass().getName(), renderFailure.getClass().getName());
        }
    }

    private void printOutcome(TestOutcome outcome) {
        out.print(style(outcome) + outcome.getLabel() + NEW_LINE + reset());
        out.flush();
    }

    private void printSummary(TestRunResult summary) {
        StringBuilder report = new StringBuilder();

        if (!summary.isSuccess()) {
            report.append(NEW_LINE).append("- - - Failures - - -").append(NEW_LINE);
            for (FailureRecord failure : summary.getFailures()) {
                report.append(" -> [").append(failure.getTestName()).append("] ")
                        .append(failure.getMessage()).append(NEW_LINE);
            }
        }

        report.append(NEW_LINE)
                .append("Total passed: [").append(summary.getPassed())
                .append(" / ").append(summary.getTotal()).append(']')
                .append(NEW_LINE);

        out.print(report);
        out.flush();
    }

    private String style(TestOutcome outcome) {
        return settings.isColorOutput() ? Ansi.of(outcome.getStyles()) : "";
    }

    private String reset() {
        return Ansi.styled(settings.isColorOutput(), AnsiStyle.NONE);
    }
}
