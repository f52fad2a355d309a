package com.webmon.core.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Retry {
    private static final Logger LOGGER = Logger.getLogger(Retry.class.getName());

    private final RetryPolicy policy;
    private final Sleeper sleeper;

    public Retry(RetryPolicy policy) {
        this(policy, Sleeper.THREAD);
    }

    public Retry(RetryPolicy policy, Sleeper sleeper) {
        this.policy = Objects.requireNonNull(policy, "policy is required");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper is required");
    }

    public <T> T call(String operation, Callable<T> action) throws InterruptedException {
        Exception lastFailure = null;
        for (int attempt = 1; attempt <= policy.tries(); attempt++) {
            int current = attempt;
            LOGGER.finer(() -> operation + " attempt " + attemptLabel(current));
            try {
                return action.call();
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (Thread.currentThread().isInterrupted()) {
                    InterruptedException interrupted = new InterruptedException(operation + " interrupted");
                    interrupted.initCause(e);
                    throw interrupted;
                }
                lastFailure = e;
                if (attempt == policy.tries()) {
                    break;
                }
                Duration wait = policy.delayAfterAttempt(attempt);
                LOGGER.log(Level.WARNING, () -> "Error on " + operation + " attempt " + attemptLabel(current)
                        + ", retrying in " + wait.toMillis() + " ms. Exception: "
                        + e.getClass().getName() + " Error message: " + e.getMessage());
                sleeper.sleep(wait);
            }
        }
        LOGGER.severe(operation + " failed after " + policy.tries() + " attempts");
        throw new RetriesExhaustedException(operation, policy.tries(), lastFailure);
    }

    public void run(String operation, ThrowingRunnable action) throws InterruptedException {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private String attemptLabel(int attempt) {
        return attempt + " of " + policy.tries();
    }

    @FunctionalInterface
    public interface ThrowingRunnable {
        void run() throws Exception;
    }
}
