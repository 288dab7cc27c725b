package ai.srt.translator.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ai.srt.translator.config.LogFormat;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = event(context, "Loaded \"movie.srt\"\nnext", Map.of());

        String json = layout.doLayout(event);

        assertThat(json).contains("\"message\":\"Loaded \\\"movie.srt\\\"\\nnext\"");
        assertThat(json).contains("\"logger\":\"ai.srt.translator.session\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"exception\"");
        assertThat(json).endsWith(System.lineSeparator());
    }

    @Test
    void includesMdcAndException() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        LoggingEvent event = event(context, "failed", Map.of("session.state", "TRANSLATING"));
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("boom")));

        String json = layout.doLayout(event);

        assertThat(json).contains("\"mdc\":{\"session.state\":\"TRANSLATING\"}");
        assertThat(json).contains("\"exception\":\"java.lang.IllegalStateException\"");
        assertThat(json).contains("\"exceptionMessage\":\"boom\"");
    }

    @Test
    void createsEncoderForEachFormat() {
        LoggerContext context = new LoggerContext();
        context.start();

        assertThat(LoggingConfigurator.createEncoder(context, LogFormat.JSON)).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(LoggingConfigurator.createEncoder(context, LogFormat.TEXT)).isInstanceOf(PatternLayoutEncoder.class);
    }

    private static LoggingEvent event(LoggerContext context, String message, Map<String, String> mdc) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("ai.srt.translator.session");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        event.setMDCPropertyMap(mdc);
        return event;
    }
}
