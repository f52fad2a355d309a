package com.webmon.service.store;

import com.webmon.service.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

public class PostgresStorageDriver extends JdbcStorageDriver {
    public PostgresStorageDriver(DatabaseConfig config) {
        super(config);
    }

    @Override
    protected String jdbcUrl() {
        return "jdbc:postgresql://" + config.host() + ":" + config.port() + "/"
                + URLEncoder.encode(config.name(), StandardCharsets.UTF_8)
                + "?sslmode=" + URLEncoder.encode(config.sslMode(), StandardCharsets.UTF_8);
    }

    @Override
    protected void customize(HikariConfig hikari) {
        hikari.setDriverClassName("org.postgresql.Driver");
        hikari.addDataSourceProperty("ApplicationName", "webmon");
    }
}
