package com.webmon.service.config;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Arrays;
import java.util.Locale;

public enum DatabaseType {
    POSTGRESQL,
    H2;

    @JsonCreator
    public static DatabaseType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("db_type is required");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if ("POSTGRES".equals(normalized)) {
            return POSTGRESQL;
        }
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported db_type: " + name));
    }
}
