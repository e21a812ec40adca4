package net.legacy.unit.foundation.runner;

import lombok.Getter;
import net.legacy.unit.foundation.terminal.AnsiStyle;

import java.util.List;

/**
 * Classification of a single test execution.
 *
 * @author qwq-dev
 * @since 2025-06-14 13:00
 */
@Getter
public enum TestOutcome {
    /**
     * The procedure returned normally.
     */
    PASS("PASS", AnsiStyle.GREEN),

    /**
     * An assertion failed.
     */
    FAIL("FAIL", AnsiStyle.RED),

    /**
     * The procedure threw an {@link Exception} outside the assertion vocabulary.
     */
    EXCEPTION("EXCEPTION", AnsiStyle.YELLOW),

    /**
     * The procedure threw a {@link Throwable} that is not an {@link Exception}.
     */
    UNRECOGNIZED_EXCEPTION("UNRECOGNIZED EXCEPTION", AnsiStyle.RED, AnsiStyle.BOLD);

    private final String label;
    private final List<AnsiStyle> styles;

    TestOutcome(String label, AnsiStyle... styles) {
        this.label = label;
        this.styles = List.of(styles);
    }
}
