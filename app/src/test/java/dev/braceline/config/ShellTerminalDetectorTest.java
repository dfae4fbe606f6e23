package dev.braceline.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ShellTerminalDetectorTest {

    @TempDir
    Path tempDir;

    @Test
    void fileOnStdinIsNotATerminal() throws IOException {
        Path input = Files.writeString(tempDir.resolve("input.txt"), "hello\n");

        assertThat(new ShellTerminalDetector(ProcessBuilder.Redirect.from(input.toFile())).stdinIsTerminal()).isFalse();
    }
}
