package com.mlorenc.project.board.core;

import com.mlorenc.project.board.exception.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

public final class Retry {

    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private Retry() {
    }

    /**
     * Runs {@code call}, retrying it on {@link TransportException} only. Any other exception
     * passes straight through. Once attempts are exhausted the last transport failure is rethrown.
     */
    public static <T> T withRetry(RetryPolicy policy, Sleeper sleeper, String operation, Supplier<T> call) {
        TransportException lastFailure = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return call.get();
            } catch (TransportException ex) {
                lastFailure = ex;
                if (attempt == policy.maxAttempts()) {
                    log.atWarn().addKeyValue("event", "board.remote.retry.exhausted")
                            .addKeyValue("operation", operation)
                            .addKeyValue("attempts", attempt)
                            .log("Remote call failed after all attempts: {}", ex.getMessage());
                    break;
                }
                Duration delay = policy.delayAfterAttempt(attempt);
                log.atInfo().addKeyValue("event", "board.remote.retry")
                        .addKeyValue("operation", operation)
                        .addKeyValue("attempt", attempt)
                        .addKeyValue("maxAttempts", policy.maxAttempts())
                        .addKeyValue("delayMs", delay.toMillis())
                        .log("Remote call failed, retrying: {}", ex.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        throw lastFailure;
    }
}
