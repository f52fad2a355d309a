package com.webmon.service.store;

import com.webmon.service.config.DatabaseConfig;

public final class StorageDrivers {
    private StorageDrivers() {
    }

    public static StorageDriver create(DatabaseConfig config) {
        return switch (config.type()) {
            case POSTGRESQL -> new PostgresStorageDriver(config);
            case H2 -> new H2StorageDriver(config);
        };
    }
}
