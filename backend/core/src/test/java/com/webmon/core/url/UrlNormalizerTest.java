package com.webmon.core.url;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UrlNormalizerTest {
    @Test
    void bareHostDefaultsToHttpsOn443() {
        assertEquals("https://foo.com:443", UrlNormalizer.normalize("foo.com", false));
    }

    @Test
    void portWithoutProtocolMeansPlainHttp() {
        assertEquals("http://foo.com:8080", UrlNormalizer.normalize("foo.com:8080", false));
        assertEquals("http://foo.com:8080/health", UrlNormalizer.normalize("foo.com:8080/health", false));
    }

    @Test
    void port443WithoutProtocolMeansHttps() {
        assertEquals("https://foo.com:443", UrlNormalizer.normalize("foo.com:443", false));
    }

    @Test
    void pathIsKeptAndSingleTrailingSlashDropped() {
        assertEquals("https://foo.io:443/health", UrlNormalizer.normalize("foo.io/health", false));
        assertEquals("https://foo.io:443/health", UrlNormalizer.normalize("foo.io/health/", false));
        assertEquals("https://foo.io:443", UrlNormalizer.normalize("foo.io/", false));
    }

    @Test
    void protocolWithoutPortPicksWellKnownPort() {
        assertEquals("https://foo.com:443", UrlNormalizer.normalize("https://foo.com", false));
        assertEquals("http://foo.com:80", UrlNormalizer.normalize("http://foo.com", false));
        assertEquals("http://foo.com:80", UrlNormalizer.normalize("HTTP://foo.com", false));
    }

    @Test
    void protocolAndPortAreUsedAsGiven() {
        assertEquals("http://foo.com:443/x", UrlNormalizer.normalize("http://foo.com:443/x", false));
        assertEquals("https://localhost:8443", UrlNormalizer.normalize("https://localhost:8443", false));
    }

    @Test
    void nakedDomainExpansionOnlyTouchesHostsWithFewerThanTwoDots() {
        assertEquals("https://www.foo.com:443", UrlNormalizer.normalize("foo.com", true));
        assertEquals("https://api.foo.com:443", UrlNormalizer.normalize("api.foo.com", true));
        assertEquals("https://foo.com:443", UrlNormalizer.normalize("foo.com"));
    }

    @Test
    void surroundingWhitespaceIsIgnored() {
        assertEquals("https://foo.com:443", UrlNormalizer.normalize("  foo.com \t", false));
    }

    @Test
    void rejectsInputWithoutHost() {
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("", false));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("   ", false));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize(null, false));
        assertThrows(MalformedUrlException.class, () -> UrlNormalizer.normalize("foo bar.com", false));
    }

    @Test
    void rejectsOverlongPort() {
        MalformedUrlException error = assertThrows(MalformedUrlException.class,
                () -> UrlNormalizer.normalize("foo.com:1234567", false));
        assertTrue(error.getMessage().contains("'foo.com:1234567'"), error.getMessage());
    }
}
