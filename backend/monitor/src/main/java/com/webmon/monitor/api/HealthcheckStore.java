package com.webmon.monitor.api;

import com.webmon.core.model.HealthcheckResult;

public interface HealthcheckStore {
    void save(HealthcheckResult result) throws InterruptedException;
}
