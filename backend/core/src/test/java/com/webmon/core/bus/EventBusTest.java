package com.webmon.core.bus;

import com.webmon.core.events.AlertRaised;
import com.webmon.core.events.Event;
import com.webmon.core.events.ProbeCompleted;
import com.webmon.core.model.MatchStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    @Test
    void deliversOnlyToMatchingSubscribers() {
        EventBus bus = new EventBus();
        List<ProbeCompleted> probes = new ArrayList<>();
        List<AlertRaised> alerts = new ArrayList<>();
        bus.subscribe(ProbeCompleted.class, probes::add);
        bus.subscribe(AlertRaised.class, alerts::add);

        bus.publish(probe(200));

        assertEquals(1, probes.size());
        assertEquals(0, alerts.size());
    }

    @Test
    void subscribingToBaseTypeSeesEverything() {
        EventBus bus = new EventBus();
        List<Event> all = new ArrayList<>();
        bus.subscribe(Event.class, all::add);

        bus.publish(probe(200));
        bus.publish(new AlertRaised(NOW, "site-task", 1, "https://foo.com:443", "boom"));

        assertEquals(2, all.size());
    }

    @Test
    void failingHandlerDoesNotStopOthers() {
        List<Exception> errors = new ArrayList<>();
        EventBus bus = new EventBus((event, error) -> errors.add(error));
        List<ProbeCompleted> received = new ArrayList<>();
        bus.subscribe(ProbeCompleted.class, event -> {
            throw new IllegalStateException("handler broke");
        });
        bus.subscribe(ProbeCompleted.class, received::add);

        ProbeCompleted event = probe(500);
        bus.publish(event);

        assertEquals(1, errors.size());
        assertEquals(1, received.size());
        assertSame(event, received.get(0));
    }

    @Test
    void closingSubscriptionStopsDelivery() {
        EventBus bus = new EventBus();
        List<ProbeCompleted> received = new ArrayList<>();
        EventBus.Subscription subscription = bus.subscribe(ProbeCompleted.class, received::add);

        bus.publish(probe(200));
        subscription.close();
        bus.publish(probe(200));

        assertEquals(1, received.size());
    }

    private static ProbeCompleted probe(int status) {
        return new ProbeCompleted(NOW, 1, "https://foo.com:443", status, 12, MatchStatus.NOT_APPLICABLE, "");
    }
}
