package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.exception.ExternalApiException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * ══════════════════════════════════════════════════════════════════
 * Third-party API Retry Executor (exponential backoff)
 * ══════════════════════════════════════════════════════════════════
 *
 * Callers see an API call as atomic: it returns data, or it throws after
 * the retries are exhausted.
 *
 * RETRY STRATEGY
 * ────────────────
 * Attempt 1  → immediate
 * Attempt 2  → wait 2s
 * Attempt 3  → wait 4s   [3 attempts total]
 *
 * HTTP 429 waits for the Retry-After header instead (10s when absent).
 *
 * WHAT IS RETRYABLE
 * ─────────────────
 * ✅ 5xx, network errors and timeouts, 429
 * ❌ Any other 4xx (ClientException), it would fail again
 */
@Component
@Slf4j
public class ApiRetryExecutor {

    static final int MAX_ATTEMPTS = 3;
    private static final long BASE_DELAY_MS = 2_000L;
    private static final long MAX_DELAY_MS = 30_000L;

    private final long baseDelayMs;
    private final boolean honourRetryAfter;

    @Autowired
    public ApiRetryExecutor() {
        this(BASE_DELAY_MS, true);
    }

    ApiRetryExecutor(long baseDelayMs, boolean honourRetryAfter) {
        this.baseDelayMs = baseDelayMs;
        this.honourRetryAfter = honourRetryAfter;
    }

    /**
     * @param context  Human-readable name for logging (e.g. "HubSpot getCompany[123]")
     * @param apiCall  The API call to execute
     * @throws ExternalApiException if a permanent error occurs or all attempts fail
     */
    public <T> T execute(String context, Supplier<T> apiCall) {
        for (int attempt = 1; ; attempt++) {
            try {
                T result = apiCall.get();
                if (attempt > 1) {
                    log.info("{} succeeded after {} attempts", context, attempt);
                }
                return result;

            } catch (ExternalApiException.ClientException ex) {
                // Permanent errors propagate immediately
                log.error("{} failed permanently (attempt {}/{}): {}",
                        context, attempt, MAX_ATTEMPTS, ex.getMessage());
                throw ex;

            } catch (ExternalApiException ex) {
                if (attempt == MAX_ATTEMPTS) {
                    log.error("{} exhausted all {} attempts. Last error: {}",
                            context, MAX_ATTEMPTS, ex.getMessage());
                    throw ex;
                }
                long delay = ex instanceof ExternalApiException.RateLimitedException rl && honourRetryAfter
                        ? rl.getRetryAfterSeconds() * 1000L
                        : backoffMs(attempt);
                log.warn("{} got retryable error (attempt {}/{}): {}. Retrying in {}ms...",
                        context, attempt, MAX_ATTEMPTS, ex.getMessage(), delay);
                sleep(delay, context);
            }
        }
    }

    /** BASE * 2^(attempt-1), capped at 30s. */
    long backoffMs(int attempt) {
        long delay = baseDelayMs * (1L << (attempt - 1));
        return Math.min(delay, MAX_DELAY_MS);
    }

    private void sleep(long ms, String context) {
        if (ms <= 0) return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ExternalApiException("retry", context + " interrupted during retry backoff");
        }
    }
}
