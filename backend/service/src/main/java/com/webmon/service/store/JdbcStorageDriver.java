package com.webmon.service.store;

import com.webmon.service.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

public abstract class JdbcStorageDriver implements StorageDriver {
    private static final Logger LOGGER = Logger.getLogger(JdbcStorageDriver.class.getName());

    protected final DatabaseConfig config;
    private volatile HikariDataSource dataSource;

    protected JdbcStorageDriver(DatabaseConfig config) {
        this.config = config;
    }

    protected abstract String jdbcUrl();

    protected void customize(HikariConfig hikari) {
    }

    @Override
    public synchronized void open() {
        if (dataSource != null) {
            return;
        }
        HikariConfig hikari = new HikariConfig();
        hikari.setJdbcUrl(jdbcUrl());
        hikari.setUsername(config.user());
        hikari.setPassword(config.password());
        hikari.setMaximumPoolSize(config.poolSize());
        hikari.setPoolName("webmon-" + config.type().name().toLowerCase(Locale.ROOT));
        customize(hikari);
        try {
            dataSource = new HikariDataSource(hikari);
        } catch (RuntimeException e) {
            throw new StorageException("Cannot connect to " + config.type() + " database " + config.name(), e);
        }
        LOGGER.info("Opened " + config.type() + " connection pool for database " + config.name());
    }

    @Override
    public synchronized void close() {
        if (dataSource == null) {
            return;
        }
        dataSource.close();
        dataSource = null;
        LOGGER.info("Closed connection pool for database " + config.name());
    }

    @Override
    public List<Map<String, Object>> fetch(String sql) {
        try (Connection connection = connection();
             Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery(sql)) {
            ResultSetMetaData meta = resultSet.getMetaData();
            List<Map<String, Object>> rows = new ArrayList<>();
            while (resultSet.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    row.put(meta.getColumnLabel(i).toLowerCase(Locale.ROOT), resultSet.getObject(i));
                }
                rows.add(row);
            }
            return rows;
        } catch (SQLException e) {
            throw new StorageException("Query failed: " + sql, e);
        }
    }

    @Override
    public void execute(String sql) {
        try (Connection connection = connection();
             Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new StorageException("Statement failed: " + sql, e);
        }
    }

    @Override
    public void executeMany(String sql, List<List<Object>> rows) {
        if (rows.isEmpty()) {
            return;
        }
        try (Connection connection = connection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (List<Object> row : rows) {
                    for (int i = 0; i < row.size(); i++) {
                        statement.setObject(i + 1, row.get(i));
                    }
                    statement.addBatch();
                }
                statement.executeBatch();
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StorageException("Batch of " + rows.size() + " rows failed: " + sql, e);
        }
    }

    @Override
    public String version() {
        try (Connection connection = connection()) {
            var meta = connection.getMetaData();
            return meta.getDatabaseProductName() + " " + meta.getDatabaseProductVersion();
        } catch (SQLException e) {
            throw new StorageException("Cannot read database version", e);
        }
    }

    private Connection connection() throws SQLException {
        HikariDataSource current = dataSource;
        if (current == null) {
            throw new StorageException("Storage driver for " + config.name() + " is not open");
        }
        return current.getConnection();
    }
}
