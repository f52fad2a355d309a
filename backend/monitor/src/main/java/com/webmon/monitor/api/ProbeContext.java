package com.webmon.monitor.api;

import com.webmon.core.bus.EventBus;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

public record ProbeContext(
        HttpClient httpClient,
        EventBus eventBus,
        Clock clock,
        Duration probeTimeout
) {
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(15);

    public ProbeContext {
        Objects.requireNonNull(httpClient, "httpClient is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(probeTimeout, "probeTimeout is required");
        if (probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be positive");
        }
    }
}
