package com.webmon.service.cli;

public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }
}
