package com.webmon.core.url;

public class MalformedUrlException extends IllegalArgumentException {
    public MalformedUrlException(String input) {
        super("Cannot extract a host from '" + input + "'");
    }
}
