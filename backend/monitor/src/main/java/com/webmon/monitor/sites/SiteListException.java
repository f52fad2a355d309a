package com.webmon.monitor.sites;

import java.nio.file.Path;

public class SiteListException extends RuntimeException {
    public SiteListException(Path file, String message) {
        super("Invalid site list " + file + ": " + message);
    }

    public SiteListException(Path file, String message, Throwable cause) {
        super("Invalid site list " + file + ": " + message, cause);
    }
}
