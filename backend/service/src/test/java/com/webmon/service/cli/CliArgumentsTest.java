package com.webmon.service.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CliArgumentsTest {
    @Test
    void parsesCsvMonitorRun() {
        CliArguments args = CliArguments.parse(new String[]{
                "--db-config", "db.json", "--sites-csv", "sites.csv", "--number-healthchecks", "5", "--log-level", "debug"
        });

        assertEquals(Action.MONITOR, args.action());
        assertEquals(Path.of("db.json"), args.dbConfig());
        assertEquals(Optional.of(Path.of("sites.csv")), args.sitesCsv());
        assertFalse(args.sitesTable());
        assertEquals(5, args.numberHealthchecks());
        assertEquals("DEBUG", args.logLevel());
        assertTrue(args.warnings().isEmpty());
    }

    @Test
    void sitesTableAcceptsOptionalValueAndUnboundedChecks() {
        CliArguments args = CliArguments.parse(new String[]{
                "--sites-table", "websites", "--db-config", "db.json", "--number-healthchecks", "-1"
        });

        assertEquals(Action.MONITOR, args.action());
        assertTrue(args.sitesTable());
        assertTrue(args.sitesCsv().isEmpty());
        assertEquals(CliArguments.UNBOUNDED_CHECKS, args.numberHealthchecks());
        assertEquals(CliArguments.DEFAULT_LOG_LEVEL, args.logLevel());
    }

    @Test
    void dropTablesWinsOverMonitoringWithWarning() {
        CliArguments args = CliArguments.parse(new String[]{
                "--db-config", "db.json", "--sites-table", "--drop-tables"
        });

        assertEquals(Action.DROP_TABLES, args.action());
        assertEquals(1, args.warnings().size());
    }

    @Test
    void dropTablesNeedsNoHealthcheckCount() {
        assertEquals(Action.DROP_TABLES, CliArguments.parse(new String[]{"--db-config", "db.json", "--drop-tables"}).action());
    }

    @Test
    void helpNeedsNothingElse() {
        assertEquals(Action.HELP, CliArguments.parse(new String[]{"--help"}).action());
        assertEquals(Action.HELP, CliArguments.parse(new String[]{"-h"}).action());
    }

    @Test
    void rejectsIncompleteOrInvalidInvocations() {
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[0]));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{"--sites-table", "--number-healthchecks", "1"}));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{"--db-config", "db.json"}));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{"--db-config", "db.json", "--sites-table"}));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{"--db-config"}));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{"--db-config", "db.json", "--frobnicate"}));
    }

    @Test
    void healthcheckCountMustBePositiveOrMinusOne() {
        ConfigException zero = assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{
                "--db-config", "db.json", "--sites-table", "--number-healthchecks", "0"
        }));
        assertTrue(zero.getMessage().contains("-1"));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{
                "--db-config", "db.json", "--sites-table", "--number-healthchecks", "-2"
        }));
        assertThrows(ConfigException.class, () -> CliArguments.parse(new String[]{
                "--db-config", "db.json", "--sites-table", "--number-healthchecks", "many"
        }));
    }
}
