package com.webmon.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.webmon.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static DatabaseConfig loadDatabase(Path file) {
        return read(file, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Config file " + path + " is empty");
            }
            return value;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path + ": " + rootMessage(e), e);
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
