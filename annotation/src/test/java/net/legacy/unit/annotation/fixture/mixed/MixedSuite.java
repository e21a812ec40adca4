package net.legacy.unit.annotation.fixture.mixed;

import net.legacy.unit.annotation.TestSuite;
import net.legacy.unit.annotation.UnitTest;
import net.legacy.unit.foundation.annotation.RunnerConfiguration;
import net.legacy.unit.foundation.assertion.TestAssertions;

import java.io.IOException;

@TestSuite(description = "One test per outcome")
@RunnerConfiguration(colorOutput = false)
public class MixedSuite {

    @UnitTest("alpha")
    static void alpha() {
        TestAssertions.assertTrue(true, "true");
    }

    @UnitTest("beta")
    static void beta() {
        TestAssertions.assertTrue(false, "false", 10);
    }

    @UnitTest("gamma")
    static void gamma() throws IOException {
        throw new IOException("boom");
    }

    @UnitTest("delta")
    static void delta() {
        throw new NoClassDefFoundError("missing.Type");
    }
}
