package com.webmon.service.store;

import com.webmon.core.model.HealthcheckResult;
import com.webmon.monitor.api.HealthcheckStore;

import java.util.List;

public class DatabaseHealthcheckStore implements HealthcheckStore {
    private final ResultSink sink;

    public DatabaseHealthcheckStore(ResultSink sink) {
        this.sink = sink;
    }

    @Override
    public void save(HealthcheckResult result) throws InterruptedException {
        if (result.websiteFk() < 0) {
            throw new IllegalArgumentException("Result references a site that was never persisted: " + result);
        }
        sink.insertMany(Tables.HEALTHCHECKS, Tables.HEALTHCHECK_SHAPE, List.of(result));
    }
}
