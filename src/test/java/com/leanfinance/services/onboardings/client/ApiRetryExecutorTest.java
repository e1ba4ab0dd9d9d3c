package com.leanfinance.services.onboardings.client;

import com.leanfinance.services.onboardings.exception.ExternalApiException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiRetryExecutorTest {

    private final ApiRetryExecutor executor = new ApiRetryExecutor(0, false);

    @Test
    void execute_retriesServerErrorsAndReturnsFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ExternalApiException("HubSpot", "502 Bad Gateway", 502);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void execute_givesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", () -> {
            calls.incrementAndGet();
            throw new ExternalApiException("HubSpot", "503", 503);
        })).isInstanceOf(ExternalApiException.class);

        assertThat(calls).hasValue(ApiRetryExecutor.MAX_ATTEMPTS);
    }

    @Test
    void execute_neverRetriesClientErrors() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", () -> {
            calls.incrementAndGet();
            throw new ExternalApiException.ClientException("HubSpot", "404 Not Found", 404);
        })).isInstanceOf(ExternalApiException.ClientException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void execute_retriesRateLimited() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("test", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new ExternalApiException.RateLimitedException("HubSpot", "429", 1);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    void backoff_doublesPerAttempt() {
        ApiRetryExecutor defaults = new ApiRetryExecutor();

        assertThat(defaults.backoffMs(1)).isEqualTo(2_000L);
        assertThat(defaults.backoffMs(2)).isEqualTo(4_000L);
        assertThat(defaults.backoffMs(10)).isEqualTo(30_000L);
    }
}
