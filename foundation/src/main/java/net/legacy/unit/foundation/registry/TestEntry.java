package net.legacy.unit.foundation.registry;

import lombok.Value;

/**
 * A named test procedure held by a {@link TestRegistry}.
 *
 * @author qwq-dev
 * @since 2025-06-14 11:40
 */
@Value
public class TestEntry {
    String name;
    TestProcedure procedure;
}
