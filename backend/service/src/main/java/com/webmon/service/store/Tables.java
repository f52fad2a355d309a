package com.webmon.service.store;

import com.webmon.core.model.HealthcheckResult;
import com.webmon.core.model.Site;

public final class Tables {
    public static final String WEBSITES = "websites";
    public static final String HEALTHCHECKS = "healthchecks";

    public static final TableShape<Site> WEBSITE_SHAPE = TableShape.of(Site.class);
    public static final TableShape<HealthcheckResult> HEALTHCHECK_SHAPE = TableShape.of(HealthcheckResult.class);

    private Tables() {
    }

    public static void createAll(ResultSink sink) throws InterruptedException {
        sink.createTableIfMissing(WEBSITES, WEBSITE_SHAPE);
        sink.createTableIfMissing(HEALTHCHECKS, HEALTHCHECK_SHAPE);
    }

    public static void dropAll(ResultSink sink) throws InterruptedException {
        sink.dropTableIfExists(HEALTHCHECKS);
        sink.dropTableIfExists(WEBSITES);
    }
}
