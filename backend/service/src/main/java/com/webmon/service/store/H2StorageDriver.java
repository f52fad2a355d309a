package com.webmon.service.store;

import com.webmon.service.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;

// db_host "mem" (or empty) keeps the database in memory; any other host is a directory.
public class H2StorageDriver extends JdbcStorageDriver {
    public H2StorageDriver(DatabaseConfig config) {
        super(config);
    }

    @Override
    protected String jdbcUrl() {
        String host = config.host();
        String location = host == null || host.isBlank() || "mem".equalsIgnoreCase(host)
                ? "mem:" + config.name()
                : "file:" + host + "/" + config.name();
        return "jdbc:h2:" + location + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";
    }

    @Override
    protected void customize(HikariConfig hikari) {
        hikari.setDriverClassName("org.h2.Driver");
    }
}
