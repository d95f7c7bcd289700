package io.querybridge.proxy.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code logging.format} and {@code logging.level} to Logback after the
 * service configuration is loaded, replacing whatever {@code logback.xml} set
 * up.
 *
 * <p>
 * The configured level applies to the root logger. Jetty and the JDBC drivers
 * stay at {@code WARN} unless the configured level is stricter.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "CONSOLE";
    static final String TEXT_PATTERN = "%d{yyyy-MM-dd'T'HH:mm:ss.SSSXXX} %-5level [%thread] %logger{30}: %msg%n";

    private static final Map<String, Level> QUIET_LOGGERS = Map.of(
            "org.eclipse.jetty", Level.WARN,
            "io.javalin", Level.INFO,
            "org.postgresql", Level.WARN,
            "com.mysql", Level.WARN);

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * @param format {@code json} for one JSON object per event, anything else for plain text
     * @param level  root level name; unknown names fall back to {@code INFO}
     */
    public static void configure(String format, String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level rootLevel = Level.toLevel(level, Level.INFO);

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setContext(context);
        console.setName(APPENDER_NAME);
        console.setEncoder(encoderFor(format, context));
        console.start();

        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.detachAndStopAllAppenders();
        root.addAppender(console);
        root.setLevel(rootLevel);

        QUIET_LOGGERS.forEach((name, quietLevel) ->
                context.getLogger(name).setLevel(rootLevel.isGreaterOrEqual(quietLevel) ? rootLevel : quietLevel));
    }

    static Encoder<ILoggingEvent> encoderFor(String format, LoggerContext context) {
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
