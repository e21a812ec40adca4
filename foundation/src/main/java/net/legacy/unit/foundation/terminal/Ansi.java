package net.legacy.unit.foundation.terminal;

import lombok.experimental.UtilityClass;
import net.legacy.unit.foundation.util.ValidationUtil;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders {@link AnsiStyle} codes as ANSI escape sequences.
 *
 * <p>The produced sequence is always {@code ESC[} followed by the codes joined with
 * {@code ;} and a trailing {@code m}, for example {@code "\u001B[31;1m"}.
 *
 * @author qwq-dev
 * @version 1.0
 * @since 2025-06-14 10:20
 */
@UtilityClass
public class Ansi {
    private static final String ESCAPE_PREFIX = "\u001B[";
    private static final char ESCAPE_SUFFIX = 'm';

    /**
     * Renders a single style.
     *
     * @param style the style to render
     * @return the escape sequence
     */
    public static String of(AnsiStyle style) {
        ValidationUtil.requireNonNull(style, "style cannot be null");
        return ESCAPE_PREFIX + style.getCode() + ESCAPE_SUFFIX;
    }

    /**
     * Renders an ordered list of styles into one escape sequence.
     *
     * @param styles the styles, at least one
     * @return the escape sequence
     * @throws IllegalArgumentException if no style is given
     */
    public static String of(AnsiStyle... styles) {
        ValidationUtil.requireNotEmpty(styles, "at least one style is required");
        return of(Arrays.asList(styles));
    }

    /**
     * Renders an ordered list of styles into one escape sequence.
     *
     * @param styles the styles, at least one
     * @return the escape sequence
     * @throws IllegalArgumentException if the list is empty
     */
    public static String of(List<AnsiStyle> styles) {
        ValidationUtil.requireNotEmpty(styles, "at least one style is required");
        return styles.stream()
                .map(style -> String.valueOf(style.getCode()))
                .collect(Collectors.joining(";", ESCAPE_PREFIX, String.valueOf(ESCAPE_SUFFIX)));
    }

    /**
     * Renders the styles when {@code enabled}, otherwise returns an empty string.
     *
     * @param enabled whether color output is enabled
     * @param styles  the styles, at least one
     * @return the escape sequence, or {@code ""}
     */
    public static String styled(boolean enabled, AnsiStyle... styles) {
        return enabled ? of(styles) : "";
    }
}
