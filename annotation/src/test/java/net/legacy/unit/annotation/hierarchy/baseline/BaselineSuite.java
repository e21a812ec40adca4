package net.legacy.unit.annotation.hierarchy.baseline;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.UnitTest;

@TestSuite
public class BaselineSuite {

    @UnitTest("baseline-runs")
    static void runs() {
    }
}
