package net.legacy.unit.foundation.registry;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

public class TestRegistryTest {
    private static final TestProcedure NOOP = () -> {
    };

    @Test
    public void entriesAreOrderedByNameNotByRegistration() {
        TestRegistry registry = TestRegistry.builder()
                .register("zeta", NOOP)
                .register("alpha", NOOP)
                .register("Beta", NOOP)
                .register("alpha2", NOOP)
                .register("gamma", NOOP)
                .build();

        List<String> names = registry.getEntries().stream()
                .map(TestEntry::getName)
                .collect(Collectors.toList());

        Assertions.assertEquals(List.of("Beta", "alpha", "alpha2", "gamma", "zeta"), names);
        Assertions.assertEquals(5, registry.size());
    }

    @Test
    public void duplicateNameIsRejectedAtRegistration() {
        TestRegistry.Builder builder = TestRegistry.builder().register("alpha", NOOP);

        DuplicateTestException exception = Assertions.assertThrows(DuplicateTestException.class,
                () -> builder.register("alpha", () -> {
                }));

        Assertions.assertEquals("alpha", exception.getTestName());
        Assertions.assertSame(NOOP, builder.build().getEntries().get(0).getProcedure());
    }

    @Test
    public void blankNameAndNullProcedureAreRejected() {
        TestRegistry.Builder builder = TestRegistry.builder();

        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.register(null, NOOP));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.register("  ", NOOP));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.register("alpha", null));
        Assertions.assertTrue(builder.build().isEmpty());
    }

    @Test
    public void builtRegistryIsReadOnly() {
        TestRegistry.Builder builder = TestRegistry.builder().register("alpha", NOOP);
        TestRegistry registry = builder.build();

        builder.register("beta", NOOP);

        Assertions.assertEquals(1, registry.size());
        Assertions.assertTrue(registry.contains("alpha"));
        Assertions.assertFalse(registry.contains("beta"));
        Assertions.assertThrows(UnsupportedOperationException.class,
                () -> registry.getEntries().add(new TestEntry("beta", NOOP)));
    }

    @Test
    public void emptyRegistryHasNoEntries() {
        Assertions.assertTrue(TestRegistry.empty().isEmpty());
        Assertions.assertEquals(0, TestRegistry.empty().size());
    }
}
