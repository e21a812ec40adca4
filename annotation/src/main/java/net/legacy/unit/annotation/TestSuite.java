package net.legacy.unit.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class whose {@link UnitTest} methods should be registered as tests.
 *
 * <p>Suites are discovered by package scanning or passed explicitly to the launcher.
 * Every {@link UnitTest} method of the class becomes one registry entry.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-15 09:30
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TestSuite {

    /**
     * Human-readable description of what this suite validates.
     *
     * <p>The description is only used for logging.
     *
     * @return the suite description
     */
    String description() default "";

    /**
     * Whether the tests of this suite are registered.
     *
     * <p>Setting this to false keeps the suite declared but excludes all of its
     * tests from the registry.
     *
     * @return true if the suite should be registered
     */
    boolean enabled() default true;

}
