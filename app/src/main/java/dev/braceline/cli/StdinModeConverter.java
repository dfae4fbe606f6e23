package dev.braceline.cli;

import dev.braceline.config.StdinMode;
import picocli.CommandLine;

/**
 * Parses stdin mode CLI options.
 */
public class StdinModeConverter implements CommandLine.ITypeConverter<StdinMode> {

    @Override
    public StdinMode convert(String value) {
        return StdinMode.from(value);
    }
}
