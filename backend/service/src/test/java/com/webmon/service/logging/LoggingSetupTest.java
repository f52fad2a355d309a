package com.webmon.service.logging;

import com.webmon.service.cli.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LoggingSetupTest {
    @Test
    void mapsCommonLevelNames() {
        assertEquals(Level.FINEST, LoggingSetup.parseLevel("trace"));
        assertEquals(Level.FINE, LoggingSetup.parseLevel("DEBUG"));
        assertEquals(Level.INFO, LoggingSetup.parseLevel("info"));
        assertEquals(Level.WARNING, LoggingSetup.parseLevel("warn"));
        assertEquals(Level.WARNING, LoggingSetup.parseLevel("WARNING"));
        assertEquals(Level.SEVERE, LoggingSetup.parseLevel("error"));
        assertEquals(Level.SEVERE, LoggingSetup.parseLevel("CRITICAL"));
    }

    @Test
    void unknownLevelIsConfigError() {
        assertThrows(ConfigException.class, () -> LoggingSetup.parseLevel("loud"));
    }

    @Test
    void applySetsApplicationLoggerLevel() {
        LoggingSetup.apply(Level.FINE);
        try {
            assertEquals(Level.FINE, Logger.getLogger("com.webmon").getLevel());
        } finally {
            LoggingSetup.apply(Level.INFO);
        }
    }
}
