package io.pagecraft.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.pagecraft.cli.config.CliConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging.*} settings of a {@link CliConfig} to Logback, replacing the startup
 * configuration from {@code logback.xml}.
 *
 * <p>Log events always go to standard error; standard output carries the rendered page only. In
 * {@code json} mode every event is one JSON object, MDC included, so the {@code template} key set
 * during a render shows up as a field.
 */
final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    /** Pattern for {@code text} mode. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} [%X{template}] - %msg%n";

    private LogbackConfigurator() {
        // utility class
    }

    static void configure(CliConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(config.loggingLevel(), Level.WARN));
        root.detachAndStopAllAppenders();
        root.addAppender(stderrAppender(context, config.loggingFormat()));

        // stays quiet when logging.level is lowered for pagecraft itself
        context.getLogger("org.springframework").setLevel(Level.WARN);
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(LoggerContext context, String format) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, format));
        appender.start();
        return appender;
    }

    static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
