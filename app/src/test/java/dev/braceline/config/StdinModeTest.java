package dev.braceline.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class StdinModeTest {

    @Test
    void parsesCaseInsensitively() {
        assertThat(StdinMode.from("Piped")).isEqualTo(StdinMode.PIPED);
        assertThat(StdinMode.from(" interactive ")).isEqualTo(StdinMode.INTERACTIVE);
        assertThat(StdinMode.from("")).isEqualTo(StdinMode.AUTO);
    }

    @Test
    void explicitModesIgnoreTerminalDetection() {
        assertThat(StdinMode.PIPED.isPiped(() -> true)).isTrue();
        assertThat(StdinMode.INTERACTIVE.isPiped(() -> false)).isFalse();
    }

    @Test
    void autoModeTreatsNonTerminalStdinAsPiped() {
        assertThat(StdinMode.AUTO.isPiped(() -> false)).isTrue();
        assertThat(StdinMode.AUTO.isPiped(() -> true)).isFalse();
    }

    @Test
    void explicitModesNeverRunTerminalDetection() {
        TerminalDetector failing = () -> {
            throw new AssertionError("terminal detection must not run");
        };

        assertThat(StdinMode.PIPED.isPiped(failing)).isTrue();
        assertThat(StdinMode.INTERACTIVE.isPiped(failing)).isFalse();
    }

    @Test
    void rejectsUnknownMode() {
        assertThatThrownBy(() -> StdinMode.from("tty")).isInstanceOf(IllegalArgumentException.class);
    }
}
