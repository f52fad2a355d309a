package com.webmon.core.events;

import com.webmon.core.model.MatchStatus;

import java.time.Instant;

public record ProbeCompleted(
        Instant timestamp,
        int websiteId,
        String url,
        int status,
        long durationMillis,
        MatchStatus matchStatus,
        String errorMessage
) implements Event {
    @Override
    public String type() {
        return "ProbeCompleted";
    }

    public boolean failed() {
        return status >= 300;
    }
}
