package net.legacy.unit.foundation.terminal;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AnsiTest {

    @Test
    public void singleStyleIsRenderedAsOneCode() {
        Assertions.assertEquals("\u001B[0m", Ansi.of(AnsiStyle.NONE));
        Assertions.assertEquals("\u001B[1m", Ansi.of(AnsiStyle.BOLD));
        Assertions.assertEquals("\u001B[31m", Ansi.of(AnsiStyle.RED));
        Assertions.assertEquals("\u001B[32m", Ansi.of(AnsiStyle.GREEN));
        Assertions.assertEquals("\u001B[33m", Ansi.of(AnsiStyle.YELLOW));
    }

    @Test
    public void multipleStylesAreJoinedInGivenOrder() {
        Assertions.assertEquals("\u001B[31;1m", Ansi.of(AnsiStyle.RED, AnsiStyle.BOLD));
        Assertions.assertEquals("\u001B[1;31m", Ansi.of(List.of(AnsiStyle.BOLD, AnsiStyle.RED)));
        Assertions.assertEquals("\u001B[1;32;0m", Ansi.of(AnsiStyle.BOLD, AnsiStyle.GREEN, AnsiStyle.NONE));
    }

    @Test
    public void zeroStylesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> Ansi.of());
        Assertions.assertThrows(IllegalArgumentException.class, () -> Ansi.of(List.of()));
    }

    @Test
    public void disabledStylingProducesNothing() {
        Assertions.assertEquals("", Ansi.styled(false, AnsiStyle.RED, AnsiStyle.BOLD));
        Assertions.assertEquals("\u001B[33m", Ansi.styled(true, AnsiStyle.YELLOW));
    }
}
