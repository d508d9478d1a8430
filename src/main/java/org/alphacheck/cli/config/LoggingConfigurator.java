package org.alphacheck.cli.config;

import java.net.URL;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;

/**
 * Applies the {@code logging} config block to Logback.
 * <pre>
 * logging {
 *   format = COLOR
 *   default-level = WARN
 *   levels {
 *     "org.alphacheck.png" = DEBUG
 *   }
 * }
 * </pre>
 * {@code format} picks the console appender of {@code logback.xml} through the
 * {@value #FORMAT_PROPERTY} system property; Logback is reloaded only when the choice changes.
 * Unknown level names fall back to {@code DEBUG} (Logback's own behaviour for
 * {@link Level#toLevel(String)}).
 */
public final class LoggingConfigurator {

    /** System property read by {@code logback.xml} to choose the root appender. */
    public static final String FORMAT_PROPERTY = "alphacheck.logging.format";

    private static final String LOGBACK_RESOURCE = "logback.xml";

    /**
     * Console layouts defined in {@code logback.xml}.
     */
    public enum LogFormat {
        PLAIN("STDOUT_PLAIN"),
        COLOR("STDOUT");

        private final String appender;

        LogFormat(String appender) {
            this.appender = appender;
        }

        public String appender() {
            return appender;
        }
    }

    private LoggingConfigurator() {
    }

    /**
     * @param config resolved application config; missing keys leave Logback untouched
     * @throws com.typesafe.config.ConfigException.BadValue if {@code logging.format} is not a {@link LogFormat}
     */
    public static void configure(Config config) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }

        if (config.hasPath("logging.format")) {
            selectFormat(context, config.getEnum(LogFormat.class, "logging.format"));
        }

        if (config.hasPath("logging.default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(config.getString("logging.default-level")));
        }

        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
                String level = String.valueOf(entry.getValue().unwrapped());
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(level));
            }
        }
    }

    private static void selectFormat(LoggerContext context, LogFormat format) {
        String current = System.getProperty(FORMAT_PROPERTY, LogFormat.PLAIN.appender());
        if (format.appender().equals(current)
                && context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(current) != null) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, format.appender());

        URL resource = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (resource == null) {
            return;
        }
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(resource);
        } catch (JoranException e) {
            // the context has no appenders left at this point
            System.err.println("Failed to apply logging format " + format + ": " + e.getMessage());
        }
    }
}
