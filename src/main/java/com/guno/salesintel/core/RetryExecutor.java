package com.guno.salesintel.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;

/**
 * Runs an operation with linear backoff: attempt {@code n} failing waits {@code baseDelay * n}
 * before attempt {@code n + 1}. {@code maxRetries} retries means {@code maxRetries + 1} attempts.
 */
@RequiredArgsConstructor
@Slf4j
public class RetryExecutor {

    private final Sleeper sleeper;

    public <T> T withRetry(Callable<T> operation, int maxRetries, long baseDelayMs) throws Exception {
        return withRetry("operation", operation, maxRetries, baseDelayMs);
    }

    /**
     * @param label used in log lines only
     * @throws Exception the last failure once every attempt is exhausted
     */
    public <T> T withRetry(String label, Callable<T> operation, int maxRetries, long baseDelayMs) throws Exception {
        int attempts = Math.max(0, maxRetries) + 1;
        Exception lastException = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastException = e;
                log.warn("{} failed - attempt {}/{}: {}", label, attempt, attempts, e.getMessage());

                if (attempt < attempts) {
                    try {
                        sleeper.sleep(baseDelayMs * attempt);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        }

        throw lastException;
    }
}
