package net.legacy.unit.annotation.fixture.passing;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.UnitTest;

@TestSuite(enabled = false)
public class DisabledSuite {

    @UnitTest("disabled-test")
    static void disabled() {
        throw new IllegalStateException("disabled suites are never registered");
    }
}
