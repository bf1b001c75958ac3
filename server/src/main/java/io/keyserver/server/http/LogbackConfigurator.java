package io.keyserver.server.http;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.keyserver.server.config.ConfigLoadException;
import io.keyserver.server.config.ServerConfig;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@code logging} section of {@link ServerConfig} to Logback.
 *
 * <p>
 * The root logger gets a single {@code STDOUT} appender. JSON mode uses
 * Logback's {@link JsonEncoder}, which carries the MDC (and so the
 * {@code requestId}) on every line; text mode prints the request id in
 * brackets. The configured level governs the root and the
 * {@code io.keyserver} loggers; Jetty is held at WARN unless the configured
 * level is stricter.
 */
public final class LogbackConfigurator {

    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} [%thread] %-5level %logger{36} [%X{requestId}] - %msg%n";
    static final String APPENDER_NAME = "STDOUT";
    static final String APPLICATION_LOGGER = "io.keyserver";

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender and sets the levels from {@code config}.
     *
     * @return the level applied to the root logger
     * @throws ConfigLoadException if {@code logging.level} is not a Logback level
     */
    public static Level configure(ServerConfig config) {
        Level level = toLevel(config.loggingLevel());
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setEncoder(
                "json".equalsIgnoreCase(config.loggingFormat()) ? jsonEncoder(context) : textEncoder(context));
        appender.start();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(appender);
        root.setLevel(level);

        context.getLogger(APPLICATION_LOGGER).setLevel(level);
        context.getLogger("org.eclipse.jetty").setLevel(level.isGreaterOrEqual(Level.WARN) ? level : Level.WARN);
        context.getLogger("io.javalin").setLevel(level.isGreaterOrEqual(Level.INFO) ? level : Level.INFO);
        return level;
    }

    static Level toLevel(String name) {
        Level level = name == null ? null : Level.toLevel(name.trim(), null);
        if (level == null) {
            throw ConfigLoadException.invalidValue("logging.level", "is not a Logback level", name);
        }
        return level;
    }

    private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
        JsonEncoder encoder = new JsonEncoder();
        encoder.setContext(context);
        encoder.start();
        return encoder;
    }

    private static Encoder<ILoggingEvent> textEncoder(LoggerContext context) {
        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(TEXT_PATTERN);
        encoder.start();
        return encoder;
    }
}
