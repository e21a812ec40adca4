package net.legacy.unit.foundation.failure;

import lombok.Getter;
import net.legacy.unit.foundation.terminal.Ansi;
import net.legacy.unit.foundation.terminal.AnsiStyle;

/**
 * Raised by an assertion when its check is violated.
 *
 * <p>The failure carries a human-readable reason and the source line of the assertion
 * call site. It extends {@link AssertionError} rather than {@link Exception}, so it is
 * never intercepted by {@code assertException}/{@code assertNoException} and is always
 * classified as {@code FAIL} by the runner.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 10:40
 */
@Getter
public class TestFailureException extends AssertionError {
    private static final long serialVersionUID = 1L;

    /**
     * Why the assertion failed.
     */
    private final String reason;

    /**
     * The line of the assertion call site.
     */
    private final int line;

    /**
     * Creates a new failure.
     *
     * @param reason why the assertion failed
     * @param line   the line of the assertion call site
     */
    public TestFailureException(String reason, int line) {
        super("Line " + line + ": " + reason);
        this.reason = reason;
        this.line = line;
    }

    /**
     * Renders the failure for the report, with the line number in bold.
     *
     * @return the rendered message
     */
    public String render() {
        return render(true);
    }

    /**
     * Renders the failure for the report.
     *
     * @param colorOutput whether to emphasize the line number with escape codes
     * @return the rendered message
     */
    public String render(boolean colorOutput) {
        return "Line " + Ansi.styled(colorOutput, AnsiStyle.BOLD) + line
                + Ansi.styled(colorOutput, AnsiStyle.NONE) + ": " + reason;
    }
}
