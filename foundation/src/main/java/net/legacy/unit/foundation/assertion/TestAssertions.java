package net.legacy.unit.foundation.assertion;

import lombok.experimental.UtilityClass;
import net.legacy.unit.foundation.failure.TestFailureException;

import java.util.Objects;

/**
 * Assertion primitives used inside test procedures.
 *
 * <p>Every assertion receives the evaluated value(s) together with the source text the
 * caller wants to see in the failure message. Values are never interpolated into messages,
 * only the texts are. On violation a {@link TestFailureException} is thrown carrying the line
 * of the assertion call site.
 *
 * <p>Each assertion exists in two forms: one taking an explicit {@code line}, and one that
 * resolves the line from the calling stack frame. The resolved line is always the one of the
 * first frame outside this class, so delegation between overloads never leaks into it.
 *
 * <pre>{@code
 * TestAssertions.assertEqual(list.size(), 3, "list.size()", "3");
 * TestAssertions.assertException(() -> parser.parse(""), "parser.parse(\"\")");
 * }</pre>
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 11:10
 */
@UtilityClass
public class TestAssertions {
    /**
     * Absolute tolerance used by {@code assertAlmostEqual}.
     */
    public static final double ALMOST_EQUAL_TOLERANCE = 0.0001;

    private static final StackWalker STACK_WALKER = StackWalker.getInstance();

    /**
     * Fails unless {@code expression} is true.
     *
     * @param expression the evaluated condition
     * @param text       the source text of the condition
     */
    public static void assertTrue(boolean expression, String text) {
        assertTrue(expression, text, callerLine());
    }

    /**
     * Fails unless {@code expression} is true.
     *
     * @param expression the evaluated condition
     * @param text       the source text of the condition
     * @param line       the line of the call site
     */
    public static void assertTrue(boolean expression, String text, int line) {
        if (!expression) {
            throw new TestFailureException("Expected TRUE, but was FALSE: \"" + text + '"', line);
        }
    }

    /**
     * Fails unless {@code expression} is false.
     *
     * @param expression the evaluated condition
     * @param text       the source text of the condition
     */
    public static void assertFalse(boolean expression, String text) {
        assertFalse(expression, text, callerLine());
    }

    /**
     * Fails unless {@code expression} is false.
     *
     * @param expression the evaluated condition
     * @param text       the source text of the condition
     * @param line       the line of the call site
     */
    public static void assertFalse(boolean expression, String text, int line) {
        if (expression) {
            throw new TestFailureException("Expected FALSE, but was TRUE: \"" + text + '"', line);
        }
    }

    /**
     * Fails unless both values are equal according to {@link Objects#equals(Object, Object)}.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(Object lhs, Object rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless both values are equal according to {@link Objects#equals(Object, Object)}.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(Object lhs, Object rhs, String lhsText, String rhsText, int line) {
        checkEqual(Objects.equals(lhs, rhs), lhsText, rhsText, line);
    }

    /**
     * Fails unless both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(long lhs, long rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(long lhs, long rhs, String lhsText, String rhsText, int line) {
        checkEqual(lhs == rhs, lhsText, rhsText, line);
    }

    /**
     * Fails unless both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(double lhs, double rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(double lhs, double rhs, String lhsText, String rhsText, int line) {
        checkEqual(lhs == rhs, lhsText, rhsText, line);
    }

    /**
     * Fails unless the boxed value is numerically equal to the primitive one.
     *
     * <p>A null boxed value is never equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(Number lhs, long rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless the boxed value is numerically equal to the primitive one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(Number lhs, long rhs, String lhsText, String rhsText, int line) {
        checkEqual(sameValue(lhs, rhs), lhsText, rhsText, line);
    }

    /**
     * Fails unless the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(long lhs, Number rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(long lhs, Number rhs, String lhsText, String rhsText, int line) {
        checkEqual(sameValue(rhs, lhs), lhsText, rhsText, line);
    }

    /**
     * Fails unless the boxed value is numerically equal to the primitive one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(Number lhs, double rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless the boxed value is numerically equal to the primitive one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(Number lhs, double rhs, String lhsText, String rhsText, int line) {
        checkEqual(sameValue(lhs, rhs), lhsText, rhsText, line);
    }

    /**
     * Fails unless the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertEqual(double lhs, Number rhs, String lhsText, String rhsText) {
        assertEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertEqual(double lhs, Number rhs, String lhsText, String rhsText, int line) {
        checkEqual(sameValue(rhs, lhs), lhsText, rhsText, line);
    }

    /**
     * Fails if both values are equal according to {@link Objects#equals(Object, Object)}.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(Object lhs, Object rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if both values are equal according to {@link Objects#equals(Object, Object)}.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(Object lhs, Object rhs, String lhsText, String rhsText, int line) {
        checkUnequal(!Objects.equals(lhs, rhs), lhsText, rhsText, line);
    }

    /**
     * Fails if both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(long lhs, long rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(long lhs, long rhs, String lhsText, String rhsText, int line) {
        checkUnequal(lhs != rhs, lhsText, rhsText, line);
    }

    /**
     * Fails if both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(double lhs, double rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if both values are numerically equal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(double lhs, double rhs, String lhsText, String rhsText, int line) {
        checkUnequal(lhs != rhs, lhsText, rhsText, line);
    }

    /**
     * Fails if the boxed value is numerically equal to the primitive one.
     *
     * <p>A null boxed value is always unequal.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(Number lhs, long rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if the boxed value is numerically equal to the primitive one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(Number lhs, long rhs, String lhsText, String rhsText, int line) {
        checkUnequal(!sameValue(lhs, rhs), lhsText, rhsText, line);
    }

    /**
     * Fails if the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(long lhs, Number rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(long lhs, Number rhs, String lhsText, String rhsText, int line) {
        checkUnequal(!sameValue(rhs, lhs), lhsText, rhsText, line);
    }

    /**
     * Fails if the boxed value is numerically equal to the primitive one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(Number lhs, double rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if the boxed value is numerically equal to the primitive one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(Number lhs, double rhs, String lhsText, String rhsText, int line) {
        checkUnequal(!sameValue(lhs, rhs), lhsText, rhsText, line);
    }

    /**
     * Fails if the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertUnequal(double lhs, Number rhs, String lhsText, String rhsText) {
        assertUnequal(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails if the primitive value is numerically equal to the boxed one.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertUnequal(double lhs, Number rhs, String lhsText, String rhsText, int line) {
        checkUnequal(!sameValue(rhs, lhs), lhsText, rhsText, line);
    }

    /**
     * Fails unless {@code |lhs - rhs| <= }{@value #ALMOST_EQUAL_TOLERANCE}.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     */
    public static void assertAlmostEqual(double lhs, double rhs, String lhsText, String rhsText) {
        assertAlmostEqual(lhs, rhs, lhsText, rhsText, callerLine());
    }

    /**
     * Fails unless {@code |lhs - rhs| <= }{@value #ALMOST_EQUAL_TOLERANCE}.
     *
     * <p>The tolerance is absolute. {@code NaN} on either side always fails.
     *
     * @param lhs     the left value
     * @param rhs     the right value
     * @param lhsText the source text of the left value
     * @param rhsText the source text of the right value
     * @param line    the line of the call site
     */
    public static void assertAlmostEqual(double lhs, double rhs, String lhsText, String rhsText, int line) {
        if (!(Math.abs(lhs - rhs) <= ALMOST_EQUAL_TOLERANCE)) {
            throw new TestFailureException("Expected ALMOST EQUAL, but was NOT ALMOST EQUAL: ["
                    + lhsText + "] and [" + rhsText + "]", line);
        }
    }

    /**
     * Fails unless {@code call} throws an {@link Exception}.
     *
     * <p>Throwables outside the {@link Exception} hierarchy, including a nested
     * {@link TestFailureException}, are not intercepted and propagate to the caller.
     *
     * @param call the call expected to throw
     * @param text the source text of the call
     */
    public static void assertException(ThrowingCall call, String text) {
        assertException(call, text, callerLine());
    }

    /**
     * Fails unless {@code call} throws an {@link Exception}.
     *
     * @param call the call expected to throw
     * @param text the source text of the call
     * @param line the line of the call site
     */
    public static void assertException(ThrowingCall call, String text, int line) {
        if (!threwException(call)) {
            throw new TestFailureException("Expected EXCEPTION, but got NO EXCEPTION: \"" + text + '"', line);
        }
    }

    /**
     * Fails if {@code call} throws an {@link Exception}.
     *
     * @param call the call expected to complete normally
     * @param text the source text of the call
     */
    public static void assertNoException(ThrowingCall call, String text) {
        assertNoException(call, text, callerLine());
    }

    /**
     * Fails if {@code call} throws an {@link Exception}.
     *
     * @param call the call expected to complete normally
     * @param text the source text of the call
     * @param line the line of the call site
     */
    public static void assertNoException(ThrowingCall call, String text, int line) {
        if (threwException(call)) {
            throw new TestFailureException("Expected NO EXCEPTION, but got EXCEPTION: \"" + text + '"', line);
        }
    }

    private static boolean threwException(ThrowingCall call) {
        try {
            call.call();
            return false;
        } catch (Exception exception) {
            return true;
        }
    }

    private static boolean sameValue(Number boxed, long primitive) {
        if (boxed == null) {
            return false;
        }

        if (boxed instanceof Long || boxed instanceof Integer || boxed instanceof Short || boxed instanceof Byte) {
            return boxed.longValue() == primitive;
        }

        return boxed.doubleValue() == primitive;
    }

    private static boolean sameValue(Number boxed, double primitive) {
        return boxed != null && boxed.doubleValue() == primitive;
    }

    private static void checkEqual(boolean equal, String lhsText, String rhsText, int line) {
        if (!equal) {
            throw new TestFailureException("Expected EQUAL, but was NOT EQUAL: ["
                    + lhsText + "] and [" + rhsText + "]", line);
        }
    }

    private static void checkUnequal(boolean unequal, String lhsText, String rhsText, int line) {
        if (!unequal) {
            throw new TestFailureException("Expected UNEQUAL, but was NOT UNEQUAL: ["
                    + lhsText + "] and [" + rhsText + "]", line);
        }
    }

    /**
     * Resolves the line of the first stack frame outside this class.
     *
     * @return the caller line, or -1 if it cannot be determined
     */
    private static int callerLine() {
        String assertionsClass = TestAssertions.class.getName();
        return STACK_WALKER.walk(frames -> frames
                .dropWhile(frame -> frame.getClassName().equals(assertionsClass))
                .findFirst()
                .map(StackWalker.StackFrame::getLineNumber)
                .orElse(-1));
    }
}
