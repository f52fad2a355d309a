package com.webmon.core.events;

import java.time.Instant;
import java.util.Objects;

public record AlertRaised(
        Instant timestamp,
        String category,
        int websiteId,
        String url,
        String message
) implements Event {
    public AlertRaised {
        Objects.requireNonNull(timestamp, "timestamp is required");
        Objects.requireNonNull(category, "category is required");
        message = message == null ? "" : message;
    }

    @Override
    public String type() {
        return "AlertRaised";
    }
}
