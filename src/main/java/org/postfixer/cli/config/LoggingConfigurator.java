package org.postfixer.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code logging} block of the application configuration to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "WARN"    # level of the root logger
 *   levels {
 *     "org.postfixer.compiler" = "DEBUG"
 *   }
 * }
 * </pre>
 * Only the first call to {@link #configure(Config)} takes effect.
 */
public final class LoggingConfigurator {

    /** Logback property that {@code logback.xml} uses to pick the console appender. */
    public static final String FORMAT_PROPERTY = "postfixer.logging.format";

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGBACK_RESOURCE = "logback.xml";

    private static boolean configured = false;

    /**
     * Console output formats and the appender that writes each of them.
     */
    public enum LogFormat {
        PLAIN("STDOUT_PLAIN"),
        JSON("STDOUT");

        private final String appenderName;

        LogFormat(String appenderName) {
            this.appenderName = appenderName;
        }

        public String appenderName() {
            return appenderName;
        }

        static LogFormat parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                LOGGER.warn("Unknown logging format '{}', using PLAIN", value);
                return PLAIN;
            }
        }
    }

    private LoggingConfigurator() {}

    /**
     * @param config The application configuration. Without a {@code logging} block Logback keeps its setup.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        configured = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging block, keeping the Logback setup.");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            final LogFormat format = logging.hasPath("format")
                    ? LogFormat.parse(logging.getString("format"))
                    : LogFormat.PLAIN;
            selectAppender(context, format);
            if (logging.hasPath("default-level")) {
                final Level rootLevel = Level.toLevel(logging.getString("default-level"), Level.WARN);
                context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
            }
            if (logging.hasPath("levels")) {
                applyLoggerLevels(context, logging.getConfig("levels"));
            }
            LOGGER.debug("Logging configured: format {}", format);
        } catch (final RuntimeException e) {
            LOGGER.error("Failed to apply logging configuration, keeping the Logback setup.", e);
        }
    }

    /**
     * The appender reference in {@code logback.xml} is substituted when the file is read, so a
     * format whose appender is not attached yet requires reading the file again.
     */
    private static void selectAppender(final LoggerContext context, final LogFormat format) {
        final String appender = format.appenderName();
        if (context.getLogger(Logger.ROOT_LOGGER_NAME).getAppender(appender) == null) {
            System.setProperty(FORMAT_PROPERTY, appender);
            reload(context);
        }
        context.putProperty(FORMAT_PROPERTY, appender);
    }

    private static void reload(final LoggerContext context) {
        final URL resource = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (resource == null) {
            LOGGER.warn("{} not found on the classpath, log format unchanged", LOGBACK_RESOURCE);
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(resource);
        } catch (final JoranException e) {
            LOGGER.warn("Failed to reload {}: {}", LOGBACK_RESOURCE, e.getMessage());
        }
    }

    private static void applyLoggerLevels(final LoggerContext context, final Config levels) {
        for (final Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = String.valueOf(entry.getValue().unwrapped());
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
        }
    }

    /**
     * Allows the next {@link #configure(Config)} call to apply again. For tests.
     */
    public static synchronized void reset() {
        configured = false;
    }
}
