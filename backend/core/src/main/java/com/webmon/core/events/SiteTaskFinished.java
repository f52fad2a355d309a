package com.webmon.core.events;

import java.time.Instant;

public record SiteTaskFinished(
        Instant timestamp,
        int websiteId,
        String url,
        String state,
        long checksCompleted
) implements Event {
    @Override
    public String type() {
        return "SiteTaskFinished";
    }
}
