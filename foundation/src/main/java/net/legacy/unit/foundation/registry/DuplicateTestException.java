package net.legacy.unit.foundation.registry;

import lombok.Getter;

/**
 * Thrown when a test name is registered twice.
 *
 * @author qwq-dev
 * @since 2025-06-14 11:40
 */
@Getter
public class DuplicateTestException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    private final String testName;

    /**
     * Creates the exception for a name that is already taken.
     *
     * @param testName the duplicated test name
     */
    public DuplicateTestException(String testName) {
        super("A test named \"" + testName + "\" is already registered");
        this.testName = testName;
    }
}
