package com.webmon.service.store;

import java.util.List;
import java.util.Map;

public interface StorageDriver extends AutoCloseable {
    void open();

    @Override
    void close();

    List<Map<String, Object>> fetch(String sql);

    void execute(String sql);

    // All rows in one transaction.
    void executeMany(String sql, List<List<Object>> rows);

    String version();
}
