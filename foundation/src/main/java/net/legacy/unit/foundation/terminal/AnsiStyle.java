package net.legacy.unit.foundation.terminal;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Terminal attributes used to decorate the test report.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 10:20
 */
@Getter
@RequiredArgsConstructor
public enum AnsiStyle {
    NONE(0),
    BOLD(1),
    RED(31),
    GREEN(32),
    YELLOW(33);

    /**
     * The numeric SGR code written inside the escape sequence.
     */
    private final int code;
}
