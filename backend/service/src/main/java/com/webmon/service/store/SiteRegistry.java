package com.webmon.service.store;

import com.webmon.core.model.Site;

import java.util.List;
import java.util.logging.Logger;

public class SiteRegistry {
    private static final Logger LOGGER = Logger.getLogger(SiteRegistry.class.getName());

    private final ResultSink sink;

    public SiteRegistry(ResultSink sink) {
        this.sink = sink;
    }

    public List<Site> reconcile(List<Site> supplied) throws InterruptedException {
        sink.insertMany(Tables.WEBSITES, Tables.WEBSITE_SHAPE, supplied);
        List<Site> stored = sink.fetchAll(Tables.WEBSITES, Tables.WEBSITE_SHAPE);
        if (stored.isEmpty()) {
            throw new EmptySiteStoreException();
        }
        LOGGER.info("Monitoring " + stored.size() + " sites (" + supplied.size() + " supplied from file)");
        return List.copyOf(stored);
    }
}
