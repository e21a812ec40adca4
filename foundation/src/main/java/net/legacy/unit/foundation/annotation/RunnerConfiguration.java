package net.legacy.unit.foundation.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Configures how a test run is reported.
 *
 * <p>This annotation can be placed on a test suite class. When a run is launched from a set
 * of suites, the configuration of the first suite is used; without one, the defaults apply.
 *
 * @author qwq-dev
 * @version 1.1
 * @since 2025-06-07 22:30
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface RunnerConfiguration {

    /**
     * Whether the report is decorated with ANSI escape sequences.
     *
     * <p>When false, the report contains exactly the same text without any escape
     * sequence, which is useful when the output is redirected to a file.
     *
     * @return true to emit colors
     */
    boolean colorOutput() default true;

    /**
     * Whether the status code of the run reflects failures.
     *
     * <p>By default a run always reports status code 0 and failures are communicated only
     * through the printed report. When enabled, a run with at least one test that did not
     * pass reports status code 1.
     *
     * @return true to report failures through the status code
     */
    boolean failOnError() default false;

    /**
     * Whether per-test timings are logged at info level instead of debug.
     *
     * @return true to enable verbose logging
     */
    boolean verboseLogging() default false;

}
