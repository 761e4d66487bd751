package org.snek.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.joran.util.ConfigurationWatchListUtil;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the application configuration to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"    # root logger level
 *   levels {
 *     "org.snek.runtime.worldgen" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format picks the root appender. The Logback configuration file refers to it as
 * {@code ${snek.logging.format}}, so a format change reloads that file with the
 * property set. Levels are applied afterwards because a reload resets them.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String FORMAT_PROPERTY = "snek.logging.format";
    private static final String FALLBACK_RESOURCE = "logback.xml";

    /**
     * Supported output formats and the appender each one routes the root logger to.
     */
    enum LogFormat {
        PLAIN("STDOUT_PLAIN"),
        JSON("STDOUT");

        private final String appenderName;

        LogFormat(String appenderName) {
            this.appenderName = appenderName;
        }

        String appenderName() {
            return appenderName;
        }

        static LogFormat parse(String value) {
            return "JSON".equalsIgnoreCase(value) ? JSON : PLAIN;
        }
    }

    private static boolean configured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies format and levels once; later calls are ignored until {@link #reset()}.
     *
     * @param config The resolved application configuration.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            return;
        }
        configured = true;
        if (!config.hasPath("logging")) {
            LOGGER.debug("No logging block, keeping Logback defaults");
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try {
            switchFormat(context, LogFormat.parse(logging.hasPath("format") ? logging.getString("format") : null));
            applyLevels(context, logging);
        } catch (final ConfigException e) {
            LOGGER.error("Invalid logging configuration, keeping Logback defaults: {}", e.getMessage());
        }
    }

    private static void switchFormat(final LoggerContext context, final LogFormat format) {
        final String appender = format.appenderName();
        System.setProperty(FORMAT_PROPERTY, appender);
        final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root.getAppender(appender) != null) {
            return;
        }

        URL source = ConfigurationWatchListUtil.getMainWatchURL(context);
        if (source == null) {
            source = LoggingConfigurator.class.getClassLoader().getResource(FALLBACK_RESOURCE);
        }
        if (source == null) {
            LOGGER.warn("No Logback configuration to reload, log format {} not applied", format);
            return;
        }

        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        try {
            configurator.doConfigure(source);
            LOGGER.debug("Log format {} via appender {}", format, appender);
        } catch (final JoranException e) {
            LOGGER.error("Reloading {} for log format {} failed", source, format, e);
        }
    }

    private static void applyLevels(final LoggerContext context, final Config logging) {
        if (logging.hasPath("default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logging.getString("default-level"), Level.INFO));
        }
        if (!logging.hasPath("levels")) {
            return;
        }
        for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
            final Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", entry.getValue().unwrapped(), entry.getKey());
                continue;
            }
            context.getLogger(entry.getKey()).setLevel(level);
        }
    }

    /**
     * Allows the next {@link #configure(Config)} call to take effect again.
     */
    public static synchronized void reset() {
        configured = false;
    }
}
