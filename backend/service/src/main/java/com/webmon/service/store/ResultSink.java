package com.webmon.service.store;

import com.webmon.core.retry.Retry;

import java.util.List;
import java.util.logging.Logger;

public class ResultSink {
    private static final Logger LOGGER = Logger.getLogger(ResultSink.class.getName());

    private final StorageDriver driver;
    private final Retry retry;

    public ResultSink(StorageDriver driver, Retry retry) {
        this.driver = driver;
        this.retry = retry;
    }

    public <T extends Record> void createTableIfMissing(String table, TableShape<T> shape) throws InterruptedException {
        String sql = shape.createTableSql(table);
        retry.run("create table " + table, () -> driver.execute(sql));
        LOGGER.fine(() -> "Ensured table " + table);
    }

    public void dropTableIfExists(String table) throws InterruptedException {
        retry.run("drop table " + table, () -> driver.execute("DROP TABLE IF EXISTS " + table));
        LOGGER.info("Dropped table " + table + " if it existed");
    }

    public <T extends Record> void insertMany(String table, TableShape<T> shape, List<T> rows) throws InterruptedException {
        if (rows.isEmpty()) {
            return;
        }
        String sql = shape.insertSql(table);
        List<List<Object>> values = rows.stream().map(shape::insertValues).toList();
        retry.run("insert into " + table, () -> driver.executeMany(sql, values));
        LOGGER.fine(() -> "Inserted " + rows.size() + " rows into " + table);
    }

    public <T extends Record> List<T> fetchAll(String table, TableShape<T> shape) throws InterruptedException {
        String sql = shape.selectAllSql(table);
        return retry.call("fetch from " + table, () -> driver.fetch(sql).stream().map(shape::fromRow).toList());
    }
}
