package com.webmon.service.store;

public class EmptySiteStoreException extends RuntimeException {
    public EmptySiteStoreException() {
        super("No sites to monitor: the " + Tables.WEBSITES + " table is empty");
    }
}
