package com.webmon.service.logging;

import com.webmon.core.bus.EventBus;
import com.webmon.core.events.AlertRaised;
import com.webmon.core.events.ProbeCompleted;
import com.webmon.core.events.SiteTaskFinished;

import java.util.logging.Level;
import java.util.logging.Logger;

public final class ProbeLogSubscriber {
    private static final Logger LOGGER = Logger.getLogger("com.webmon.probes");

    private ProbeLogSubscriber() {
    }

    public static void register(EventBus eventBus) {
        eventBus.subscribe(ProbeCompleted.class, ProbeLogSubscriber::onProbe);
        eventBus.subscribe(AlertRaised.class, alert -> LOGGER.warning(alert.message()));
        eventBus.subscribe(SiteTaskFinished.class, finished -> LOGGER.fine(() -> "Task for " + finished.url()
                + " " + finished.state() + " after " + finished.checksCompleted() + " checks"));
    }

    static void onProbe(ProbeCompleted event) {
        Level level = event.failed() ? Level.SEVERE : Level.INFO;
        if (!LOGGER.isLoggable(level)) {
            return;
        }
        StringBuilder line = new StringBuilder()
                .append("Got response [").append(event.status()).append("] for URL: ").append(event.url())
                .append(" in ").append(event.durationMillis()).append(" ms")
                .append(", match ").append(event.matchStatus());
        if (!event.errorMessage().isEmpty()) {
            line.append(", error: ").append(event.errorMessage());
        }
        LOGGER.log(level, line.toString());
    }
}
