package com.webmon.service.logging;

import com.webmon.service.cli.ConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class LoggingSetup {
    private static final String CONFIG_RESOURCE = "/logging.properties";
    // Held strongly so the configured levels survive logger garbage collection.
    private static final Logger ROOT_LOGGER = Logger.getLogger("");
    private static final Logger APP_LOGGER = Logger.getLogger("com.webmon");
    private static final Map<String, Level> LEVELS = Map.of(
            "TRACE", Level.FINEST,
            "DEBUG", Level.FINE,
            "INFO", Level.INFO,
            "WARN", Level.WARNING,
            "WARNING", Level.WARNING,
            "ERROR", Level.SEVERE,
            "CRITICAL", Level.SEVERE
    );

    private LoggingSetup() {
    }

    public static Level parseLevel(String name) {
        Level level = LEVELS.get(name.trim().toUpperCase(Locale.ROOT));
        if (level == null) {
            throw new ConfigException("unknown log level '" + name + "'; use one of TRACE, DEBUG, INFO, WARNING, ERROR, CRITICAL");
        }
        return level;
    }

    public static void apply(Level level) {
        try (InputStream in = LoggingSetup.class.getResourceAsStream(CONFIG_RESOURCE)) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading " + CONFIG_RESOURCE, e);
        }
        ROOT_LOGGER.setLevel(level);
        APP_LOGGER.setLevel(level);
    }
}
