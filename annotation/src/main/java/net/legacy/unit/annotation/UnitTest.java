package net.legacy.unit.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares a test method inside a {@link TestSuite}.
 *
 * <p>The method must take no parameters and return {@code void}. A static method is
 * invoked directly; an instance method is invoked on a fresh instance created through the
 * suite's no-argument constructor for every run.
 *
 * <pre>{@code
 * @TestSuite
 * public class ParserTests {
 *     @UnitTest("parses-empty-input")
 *     static void parsesEmptyInput() {
 *         TestAssertions.assertTrue(Parser.parse("").isEmpty(), "Parser.parse(\"\").isEmpty()");
 *     }
 * }
 * }</pre>
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-15 09:30
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface UnitTest {

    /**
     * The unique test name.
     *
     * <p>When empty, the method name is used. Names must be unique across every suite
     * of a run.
     *
     * @return the test name
     */
    String value() default "";

}
