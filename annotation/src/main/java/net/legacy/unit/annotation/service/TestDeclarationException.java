package net.legacy.unit.annotation.service;

/**
 * Thrown when a suite or test method is declared in a way that cannot be registered.
 *
 * @author qwq-dev
 * @since 2025-06-15 09:30
 */
public class TestDeclarationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message what is wrong with the declaration
     */
    public TestDeclarationException(String message) {
        super(message);
    }

    /**
     * Creates the exception with the reflective failure behind it.
     *
     * @param message what is wrong with the declaration
     * @param cause   the underlying failure
     */
    public TestDeclarationException(String message, Throwable cause) {
        super(message, cause);
    }
}
