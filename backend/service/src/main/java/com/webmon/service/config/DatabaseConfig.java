package com.webmon.service.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DatabaseConfig(
        @JsonProperty("db_type") DatabaseType type,
        @JsonProperty("db_user") String user,
        @JsonProperty("db_pass") String password,
        @JsonProperty("db_name") String name,
        @JsonProperty("db_host") String host,
        @JsonProperty("db_port") Integer port,
        @JsonProperty("db_ssl") String sslMode,
        @JsonProperty("db_pool_size") Integer poolSize
) {
    public static final int DEFAULT_POOL_SIZE = 10;

    public DatabaseConfig {
        if (type == null) {
            throw new IllegalArgumentException("db_type is required");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("db_name is required");
        }
        if (type == DatabaseType.POSTGRESQL) {
            if (host == null || host.isBlank()) {
                throw new IllegalArgumentException("db_host is required for " + type);
            }
            if (port == null || port < 1 || port > 65535) {
                throw new IllegalArgumentException("db_port must be between 1 and 65535 for " + type);
            }
        }
        if (poolSize != null && poolSize < 1) {
            throw new IllegalArgumentException("db_pool_size must be >= 1");
        }
        user = user == null ? "" : user;
        password = password == null ? "" : password;
        sslMode = sslMode == null || sslMode.isBlank() ? "prefer" : sslMode;
        poolSize = poolSize == null ? DEFAULT_POOL_SIZE : poolSize;
    }

    @Override
    public String toString() {
        return "DatabaseConfig[type=" + type + ", user=" + user + ", name=" + name + ", host=" + host
                + ", port=" + port + ", sslMode=" + sslMode + ", poolSize=" + poolSize + "]";
    }
}
