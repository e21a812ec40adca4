package net.legacy.unit.foundation.runner;

import lombok.Builder;
import lombok.Value;
import net.legacy.unit.foundation.annotation.RunnerConfiguration;

/**
 * Immutable settings of a {@link TestRunner}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 13:00
 */
@Value
@Builder
public class RunnerSettings {
    /**
     * Status code of a run when every test passed, and by default of any run.
     */
    public static final int STATUS_SUCCESS = 0;

    /**
     * Status code of a run with failures when {@link #failOnError} is enabled.
     */
    public static final int STATUS_FAILURE = 1;

    @Builder.Default
    boolean colorOutput = true;

    @Builder.Default
    boolean failOnError = false;

    @Builder.Default
    boolean verboseLogging = false;

    /**
     * Gets the default settings: colored output, status code always 0.
     *
     * @return the default settings
     */
    public static RunnerSettings defaults() {
        return RunnerSettings.builder().build();
    }

    /**
     * Translates a {@link RunnerConfiguration} into settings.
     *
     * @param configuration the configuration, may be null
     * @return the settings, or {@link #defaults()} when {@code configuration} is null
     */
    public static RunnerSettings from(RunnerConfiguration configuration) {
        if (configuration == null) {
            return defaults();
        }

        return RunnerSettings.builder()
                .colorOutput(configuration.colorOutput())
                .failOnError(configuration.failOnError())
                .verboseLogging(configuration.verboseLogging())
                .build();
    }

    /**
     * Computes the status code of a finished run.
     *
     * @param result the run result
     * @return the status code
     */
    public int statusCodeOf(TestRunResult result) {
        return failOnError && !result.isSuccess() ? STATUS_FAILURE : STATUS_SUCCESS;
    }
}
