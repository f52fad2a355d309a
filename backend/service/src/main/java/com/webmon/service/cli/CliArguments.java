package com.webmon.service.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public record CliArguments(
        Action action,
        Path dbConfig,
        Optional<Path> sitesCsv,
        boolean sitesTable,
        int numberHealthchecks,
        String logLevel,
        List<String> warnings
) {
    public static final int UNBOUNDED_CHECKS = -1;
    public static final String DEFAULT_LOG_LEVEL = "INFO";

    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: webmon --db-config FILE (--sites-csv FILE | --sites-table) --number-healthchecks N [--log-level LEVEL]",
            "       webmon --db-config FILE --drop-tables",
            "",
            "Monitor a list of sites and save healthcheck results in a database.",
            "",
            "  --db-config FILE            JSON file with database access details (required)",
            "  --sites-csv FILE            CSV rows of host,interval[,pattern]; added to the sites already stored",
            "  --sites-table               monitor the sites already stored in the database",
            "  --number-healthchecks N     checks per site, -1 for no limit",
            "  --drop-tables               drop the websites and healthchecks tables",
            "  --log-level LEVEL           TRACE, DEBUG, INFO (default), WARNING, ERROR or CRITICAL",
            "  --help                      print this message",
            "",
            "Examples:",
            "  webmon --db-config secrets/db.json --sites-csv data/websites.csv --number-healthchecks 5",
            "  webmon --db-config secrets/db.json --sites-table --number-healthchecks -1",
            "  webmon --db-config secrets/db.json --drop-tables"
    );

    public static CliArguments parse(String[] args) {
        if (args.length == 0) {
            throw new ConfigException("no arguments given");
        }

        Path dbConfig = null;
        Path sitesCsv = null;
        boolean sitesTable = false;
        boolean dropTables = false;
        boolean help = false;
        String healthchecks = null;
        String logLevel = DEFAULT_LOG_LEVEL;
        List<String> warnings = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--db-config" -> dbConfig = Path.of(requireValue(args, i++, arg));
                case "--sites-csv" -> sitesCsv = Path.of(requireValue(args, i++, arg));
                case "--number-healthchecks" -> healthchecks = requireValue(args, i++, arg);
                case "--log-level" -> logLevel = requireValue(args, i++, arg).toUpperCase(Locale.ROOT);
                case "--sites-table" -> {
                    sitesTable = true;
                    if (i + 1 < args.length && !args[i + 1].startsWith("--")) {
                        i++;
                    }
                }
                case "--drop-tables" -> dropTables = true;
                case "--help", "-h" -> help = true;
                default -> throw new ConfigException("unknown argument: " + arg);
            }
        }

        if (help) {
            return new CliArguments(Action.HELP, dbConfig, Optional.empty(), false, 0, logLevel, List.of());
        }
        if (dbConfig == null) {
            throw new ConfigException("a db config file needs to be provided with --db-config");
        }

        boolean monitor = sitesCsv != null || sitesTable;
        if (dropTables) {
            if (monitor) {
                warnings.add("--drop-tables given together with a site source; only dropping tables");
            }
            return new CliArguments(Action.DROP_TABLES, dbConfig, Optional.empty(), false, 0, logLevel, List.copyOf(warnings));
        }
        if (!monitor) {
            throw new ConfigException("nothing to do: use --sites-csv, --sites-table or --drop-tables");
        }
        if (healthchecks == null) {
            throw new ConfigException("the number of healthchecks needs to be provided with --number-healthchecks; use -1 for no limit");
        }
        int checks;
        try {
            checks = Integer.parseInt(healthchecks.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("--number-healthchecks must be an integer but was '" + healthchecks + "'");
        }
        if (checks < 1 && checks != UNBOUNDED_CHECKS) {
            throw new ConfigException("--number-healthchecks must be >= 1 or -1 but was " + checks);
        }
        return new CliArguments(
                Action.MONITOR,
                dbConfig,
                Optional.ofNullable(sitesCsv),
                sitesTable,
                checks,
                logLevel,
                List.copyOf(warnings)
        );
    }

    private static String requireValue(String[] args, int index, String flag) {
        if (index + 1 >= args.length || args[index + 1].startsWith("--")) {
            throw new ConfigException(flag + " requires a value");
        }
        return args[index + 1];
    }
}
