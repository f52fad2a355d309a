package com.webmon.core.model;

import com.webmon.core.schema.PrimaryKey;
import com.webmon.core.schema.Unique;

import java.util.Objects;

public record Site(
        @PrimaryKey int websiteId,
        @Unique String url,
        int intervalSeconds,
        String contentPattern
) {
    public static final int UNSAVED_ID = -1;

    public Site {
        Objects.requireNonNull(url, "url is required");
        if (intervalSeconds < 0) {
            throw new IllegalArgumentException("intervalSeconds must be >= 0 but was " + intervalSeconds);
        }
        contentPattern = contentPattern == null ? "" : contentPattern;
    }

    public static Site unsaved(String url, int intervalSeconds, String contentPattern) {
        return new Site(UNSAVED_ID, url, intervalSeconds, contentPattern);
    }

    public boolean persisted() {
        return websiteId != UNSAVED_ID;
    }

    public boolean hasContentPattern() {
        return !contentPattern.isEmpty();
    }
}
