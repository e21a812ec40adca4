package net.legacy.unit.annotation.hierarchy.base;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.UnitTest;
import net.legacy.unit.foundation.assertion.TestAssertions;

@TestSuite(description = "Base class extended by a plain subclass")
public class BaseSuite {

    @UnitTest("base-runs")
    void runs() {
        TestAssertions.assertTrue(true, "true");
    }
}
