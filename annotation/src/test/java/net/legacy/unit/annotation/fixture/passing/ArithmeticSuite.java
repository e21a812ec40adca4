package net.legacy.unit.annotation.fixture.passing;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.UnitTest;
import net.legacy.unit.foundation.assertion.TestAssertions;

@TestSuite(description = "Integer and floating point arithmetic")
public class ArithmeticSuite {

    @UnitTest("addition")
    static void addition() {
        TestAssertions.assertEqual(2 + 2, 4, "2 + 2", "4");
    }

    @UnitTest("division-by-zero")
    static void divisionByZero() {
        int zero = 0;
        TestAssertions.assertException(() -> Math.floorDiv(1, zero), "Math.floorDiv(1, zero)");
    }

    @UnitTest
    static void thirds() {
        TestAssertions.assertAlmostEqual(1.0 / 3.0, 0.3333, "1.0 / 3.0", "0.3333");
    }

    static void notATest() {
        throw new IllegalStateException("must never run");
    }
}
