package com.webmon.core.url;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class UrlNormalizer {
    private static final Pattern URL_PARTS = Pattern.compile(
            "^(?:(?<protocol>[A-Za-z][A-Za-z0-9+.-]*)://)?(?<host>[^:/ ]+)(?::(?<port>[0-9]{0,5}))?(?:/(?<path>.*))?$"
    );
    private static final String HTTPS = "https";
    private static final String HTTP = "http";
    private static final int HTTPS_PORT = 443;
    private static final int HTTP_PORT = 80;

    private UrlNormalizer() {
    }

    public static String normalize(String raw) {
        return normalize(raw, false);
    }

    public static String normalize(String raw, boolean expandNakedDomain) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedUrlException(String.valueOf(raw));
        }
        Matcher matcher = URL_PARTS.matcher(raw.trim());
        if (!matcher.matches()) {
            throw new MalformedUrlException(raw);
        }

        String protocol = matcher.group("protocol");
        String host = matcher.group("host");
        String port = matcher.group("port");
        String path = matcher.group("path");

        if (expandNakedDomain && dotCount(host) < 2) {
            host = "www." + host;
        }

        boolean hasProtocol = protocol != null && !protocol.isEmpty();
        boolean hasPort = port != null && !port.isEmpty();
        int resolvedPort;
        if (!hasPort && !hasProtocol) {
            protocol = HTTPS;
            resolvedPort = HTTPS_PORT;
        } else if (!hasProtocol) {
            resolvedPort = Integer.parseInt(port);
            protocol = resolvedPort == HTTPS_PORT ? HTTPS : HTTP;
        } else if (!hasPort) {
            protocol = protocol.toLowerCase(Locale.ROOT);
            resolvedPort = HTTPS.equals(protocol) ? HTTPS_PORT : HTTP_PORT;
        } else {
            protocol = protocol.toLowerCase(Locale.ROOT);
            resolvedPort = Integer.parseInt(port);
        }

        String url = protocol + "://" + host + ":" + resolvedPort + "/" + (path == null ? "" : path);
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static int dotCount(String host) {
        int dots = 0;
        for (int i = 0; i < host.length(); i++) {
            if (host.charAt(i) == '.') {
                dots++;
            }
        }
        return dots;
    }
}
