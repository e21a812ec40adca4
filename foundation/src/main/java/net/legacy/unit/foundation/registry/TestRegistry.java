package net.legacy.unit.foundation.registry;

import net.legacy.unit.foundation.util.TestLogger;
import net.legacy.unit.foundation.util.ValidationUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable mapping from test name to test procedure.
 *
 * <p>A registry is assembled by a {@link Builder} during an explicit initialization phase
 * and is read-only afterwards. Entries are always iterated in lexicographic order of their
 * names, independent of the order in which they were registered.
 *
 * <pre>{@code
 * TestRegistry registry = TestRegistry.builder()
 *         .register("parses-empty-input", ParserTests::parsesEmptyInput)
 *         .register("rejects-bad-token", ParserTests::rejectsBadToken)
 *         .build();
 * }</pre>
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 11:40
 */
public final class TestRegistry {
    private static final String MODULE_NAME = "registry";

    private final List<TestEntry> entries;

    private TestRegistry(Map<String, TestProcedure> procedures) {
        List<TestEntry> ordered = new ArrayList<>(procedures.size());
        procedures.forEach((name, procedure) -> ordered.add(new TestEntry(name, procedure)));
        this.entries = Collections.unmodifiableList(ordered);
    }

    /**
     * Creates a new builder.
     *
     * @return an empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a registry without any test.
     *
     * @return the empty registry
     */
    public static TestRegistry empty() {
        return builder().build();
    }

    /**
     * Gets the registered entries in name order.
     *
     * @return an unmodifiable list of entries
     */
    public List<TestEntry> getEntries() {
        return entries;
    }

    /**
     * Gets the number of registered tests.
     *
     * @return the entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Checks whether no test is registered.
     *
     * @return true if the registry is empty
     */
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Checks whether a test with the given name is registered.
     *
     * @param name the test name
     * @return true if registered
     */
    public boolean contains(String name) {
        return entries.stream().anyMatch(entry -> entry.getName().equals(name));
    }

    /**
     * Collects registrations before the run starts.
     *
     * <p>Names must be unique; registering a name twice is rejected immediately with a
     * {@link DuplicateTestException}. Registries already built never see later registrations.
     */
    public static final class Builder {
        private final Map<String, TestProcedure> procedures = new TreeMap<>();

        private Builder() {
        }

        /**
         * Registers a test.
         *
         * @param name      the unique, non-blank test name
         * @param procedure the test body
         * @return this builder
         * @throws IllegalArgumentException if the name is blank or the procedure is null
         * @throws DuplicateTestException   if the name is already registered
         */
        public Builder register(String name, TestProcedure procedure) {
            ValidationUtil.requireNotBlank(name, "test name cannot be blank");
            ValidationUtil.requireNonNull(procedure, "test procedure cannot be null");

            if (procedures.putIfAbsent(name, procedure) != null) {
                throw new DuplicateTestException(name);
            }

            TestLogger.logDebug(MODULE_NAME, "Registered test: %s", name);
            return this;
        }

        /**
         * Assembles the registry.
         *
         * @return an immutable registry ordered by name
         */
        public TestRegistry build() {
            return new TestRegistry(procedures);
        }
    }
}
