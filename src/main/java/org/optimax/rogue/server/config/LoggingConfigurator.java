package org.optimax.rogue.server.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" or "JSON"
 *   default-level = "INFO"  # root logger level
 *   levels {
 *     "org.optimax.rogue.runtime.Updater" = "DEBUG"
 *   }
 * }
 * </pre>
 * The format selects one of the two console appenders declared in {@code logback.xml} through
 * the {@value #FORMAT_PROPERTY} property, which requires Logback to re-read its configuration.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    public static final String FORMAT_PROPERTY = "rogue.logging.format";
    private static final String LOGGING_PATH = "logging";

    private LoggingConfigurator() {
    }

    /**
     * Applies format, default level and per-logger levels. Missing keys leave Logback's
     * settings untouched.
     *
     * @param config the root configuration
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_PATH)) {
            LOG.debug("No logging block configured, keeping Logback defaults.");
            return;
        }
        final Config logging = config.getConfig(LOGGING_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("format")) {
            applyFormat(logging.getString("format"), context);
        }
        if (logging.hasPath("default-level")) {
            final Level level = Level.toLevel(logging.getString("default-level"), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOG.debug("Root log level set to {}", level);
        }
        if (logging.hasPath("levels")) {
            int count = 0;
            for (final Map.Entry<String, ConfigValue> entry : logging.getConfig("levels").root().entrySet()) {
                final String name = stripQuotes(entry.getKey());
                final Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), null);
                if (level == null) {
                    LOG.warn("Ignoring unknown log level '{}' for logger '{}'", entry.getValue().unwrapped(), name);
                    continue;
                }
                context.getLogger(name).setLevel(level);
                count++;
            }
            LOG.debug("Configured {} logger levels.", count);
        }
    }

    private static void applyFormat(final String format, final LoggerContext context) {
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT_JSON" : "STDOUT_PLAIN";
        if (appender.equals(context.getProperty(FORMAT_PROPERTY))) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);
        final URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            LOG.debug("No logback.xml on the classpath, log format stays as is.");
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        try {
            configurator.doConfigure(logbackXml);
        } catch (final JoranException e) {
            throw new IllegalStateException("Failed to reload logback.xml with format " + format, e);
        }
        LOG.debug("Log format switched to {}", appender);
    }

    private static String stripQuotes(final String key) {
        if (key.length() >= 2 && key.startsWith("\"") && key.endsWith("\"")) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
