package com.webmon.monitor.probe;

import com.webmon.core.events.ProbeCompleted;
import com.webmon.core.model.HealthcheckResult;
import com.webmon.core.model.MatchStatus;
import com.webmon.core.model.Site;
import com.webmon.monitor.api.ProbeContext;
import com.webmon.monitor.api.Prober;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public class HttpProber implements Prober {
    private static final Logger LOGGER = Logger.getLogger(HttpProber.class.getName());

    static final Map<String, String> BROWSER_HEADERS = Map.of(
            "User-Agent", "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) "
                    + "Chrome/124.0.0.0 Safari/537.36",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5",
            "Referer", "https://www.google.com/"
    );

    private final ProbeContext ctx;

    public HttpProber(ProbeContext ctx) {
        this.ctx = ctx;
    }

    @Override
    public HealthcheckResult probe(Site site, ProbeLimiter limiter) throws InterruptedException {
        long probeStartedAt = ctx.clock().millis();
        long deadline = System.nanoTime() + ctx.probeTimeout().toNanos();

        Fetch fetch = fetch(site, limiter, probeStartedAt, deadline);
        long elapsedMillis = Math.max(0, ctx.clock().millis() - fetch.startedAtMillis());

        MatchStatus matchStatus = MatchStatus.NOT_APPLICABLE;
        String errorMessage = fetch.errorMessage();
        if (site.hasContentPattern()) {
            matchStatus = MatchStatus.NOT_MATCHED;
            if (fetch.body() != null) {
                try {
                    matchStatus = Pattern.compile(site.contentPattern()).matcher(fetch.body()).find()
                            ? MatchStatus.MATCHED
                            : MatchStatus.NOT_MATCHED;
                } catch (PatternSyntaxException e) {
                    errorMessage = describe(e);
                } catch (RuntimeException | StackOverflowError e) {
                    LOGGER.warning(() -> "Pattern match failed for " + site.url() + ": " + describe(e));
                    errorMessage = describe(e);
                }
            }
        }

        HealthcheckResult result = HealthcheckResult.unsaved(
                site.websiteId(),
                HealthcheckResult.toSeconds(fetch.startedAtMillis()),
                HealthcheckResult.toSeconds(elapsedMillis),
                fetch.status(),
                matchStatus,
                errorMessage
        );
        ctx.eventBus().publish(new ProbeCompleted(
                ctx.clock().instant(),
                site.websiteId(),
                site.url(),
                result.httpStatusCode(),
                elapsedMillis,
                result.matchStatus(),
                result.errorMessage()
        ));
        return result;
    }

    private Fetch fetch(Site site, ProbeLimiter limiter, long probeStartedAt, long deadline) throws InterruptedException {
        LOGGER.fine(() -> "Waiting for probe slot for " + site.url()
                + " (in flight " + limiter.inFlight() + "/" + limiter.capacity() + ", queued " + limiter.queueLength() + ")");
        Optional<ProbeLimiter.Permit> permit = limiter.tryAcquire(remaining(deadline));
        if (permit.isEmpty()) {
            return Fetch.failed(probeStartedAt, HealthcheckResult.STATUS_TIMEOUT,
                    TimeoutException.class.getName() + ": no probe slot available within " + ctx.probeTimeout());
        }

        try (ProbeLimiter.Permit ignored = permit.get()) {
            LOGGER.fine(() -> "Probe slot acquired for " + site.url());
            long requestStartedAt = ctx.clock().millis();
            Duration left = remaining(deadline);
            if (left.isZero()) {
                return Fetch.failed(requestStartedAt, HealthcheckResult.STATUS_TIMEOUT,
                        TimeoutException.class.getName() + ": probe budget spent waiting for a slot");
            }

            HttpRequest request;
            try {
                request = buildRequest(site, left);
            } catch (IllegalArgumentException e) {
                return Fetch.failed(requestStartedAt, HealthcheckResult.STATUS_TRANSPORT_FAILURE, describe(e));
            }

            HttpResponse.BodyHandler<String> bodyHandler = site.hasContentPattern()
                    ? HttpResponse.BodyHandlers.ofString()
                    : HttpResponse.BodyHandlers.replacing(null);
            CompletableFuture<HttpResponse<String>> pending = ctx.httpClient().sendAsync(request, bodyHandler);
            try {
                HttpResponse<String> response = pending.get(left.toNanos(), TimeUnit.NANOSECONDS);
                return new Fetch(requestStartedAt, response.statusCode(), response.body(), "");
            } catch (TimeoutException e) {
                pending.cancel(true);
                return Fetch.failed(requestStartedAt, HealthcheckResult.STATUS_TIMEOUT,
                        TimeoutException.class.getName() + ": no response within " + ctx.probeTimeout());
            } catch (ExecutionException e) {
                Throwable cause = rootCause(e);
                int status = isTimeout(e.getCause()) || isTimeout(cause)
                        ? HealthcheckResult.STATUS_TIMEOUT
                        : HealthcheckResult.STATUS_TRANSPORT_FAILURE;
                return Fetch.failed(requestStartedAt, status, describe(cause));
            } catch (InterruptedException e) {
                pending.cancel(true);
                throw e;
            }
        }
    }

    private HttpRequest buildRequest(Site site, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(site.url()))
                .GET()
                .timeout(timeout);
        BROWSER_HEADERS.forEach(builder::header);
        return builder.build();
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
    }

    private static boolean isTimeout(Throwable error) {
        return error instanceof HttpTimeoutException || error instanceof TimeoutException;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getName();
        }
        return error.getClass().getName() + ": " + message;
    }

    private record Fetch(long startedAtMillis, int status, String body, String errorMessage) {
        static Fetch failed(long startedAtMillis, int status, String errorMessage) {
            return new Fetch(startedAtMillis, status, null, errorMessage);
        }
    }
}
