package com.webmon.monitor.api;

import com.webmon.core.model.HealthcheckResult;
import com.webmon.core.model.Site;
import com.webmon.monitor.probe.ProbeLimiter;

public interface Prober {
    HealthcheckResult probe(Site site, ProbeLimiter limiter) throws InterruptedException;
}
