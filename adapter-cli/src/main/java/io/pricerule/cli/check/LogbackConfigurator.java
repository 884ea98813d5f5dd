package io.pricerule.cli.check;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import org.slf4j.LoggerFactory;

/**
 * Points the checker's logging at stderr once {@code logging.format} and {@code logging.level}
 * are known.
 *
 * <p>
 * The checker prints exactly one JSON document on stdout, so every log line, including the
 * engine's DEBUG trace of accepted and rejected rules, must stay on stderr. {@code logback.xml}
 * covers the time before the configuration file has been read; {@link #configure} replaces its
 * appender with a single {@code STDERR} appender. Calling it again swaps the appender
 * rather than adding a second one, so repeated runs in one JVM do not duplicate lines.
 */
public final class LogbackConfigurator {

    /** Single line per event, without date or thread. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    static final String APPENDER_NAME = "STDERR";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format {@code json} for one JSON object per event, anything else for
     *               {@link #TEXT_PATTERN}
     * @param level  root level name; unknown names fall back to WARN, the checker's quiet
     *               default
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.setLevel(Level.toLevel(level, Level.WARN));
        root.detachAndStopAllAppenders();
        root.addAppender(stderrAppender(context, encoderFor(format, context)));
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(
            LoggerContext context, Encoder<ILoggingEvent> encoder) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder);
        appender.start();
        return appender;
    }

    private static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
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
