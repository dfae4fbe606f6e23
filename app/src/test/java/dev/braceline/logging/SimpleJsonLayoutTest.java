package dev.braceline.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import dev.braceline.transform.StructureException;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("test.logger");
        event.setMessage("rendered \"if\" block");
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"rendered \\\"if\\\" block\"");
        assertThat(json).contains("\"logger\":\"test.logger\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesExceptionSummary() {
        LoggerContext context = new LoggerContext();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = new LoggingEvent("fqcn", context.getLogger("test.logger"), Level.WARN,
                "transform failed", new StructureException(), null);

        String json = layout.doLayout(event);

        assertThat(json).contains("\"exception\":\"dev.braceline.transform.StructureException: too many closing brackets\"");
    }
}
