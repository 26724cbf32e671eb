package com.kbengine.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class InMemoryDualRateLimiterTest {

    private static final int RPM_LIMIT = 3;
    private static final int TPM_LIMIT = 100;

    private InMemoryDualRateLimiter limiter;

    @BeforeEach
    void setUp() {
        limiter = new InMemoryDualRateLimiter(RPM_LIMIT, TPM_LIMIT);
    }

    @Test
    void shouldEnforceRequestLimit() {
        String key = "embeddings";
        AtomicInteger calls = new AtomicInteger();

        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.execute(key, 1, calls::incrementAndGet);
        }

        CompletableFuture<Integer> blocked = CompletableFuture.supplyAsync(() ->
            limiter.execute(key, 1, calls::incrementAndGet));

        assertThrows(TimeoutException.class, () -> blocked.get(200, TimeUnit.MILLISECONDS));
        assertThat(calls.get()).isEqualTo(RPM_LIMIT);
        blocked.cancel(true);
    }

    @Test
    void shouldEnforceTokenLimit() {
        String key = "tokens";

        limiter.execute(key, TPM_LIMIT, () -> "full");

        CompletableFuture<String> blocked = CompletableFuture.supplyAsync(() ->
            limiter.execute(key, 1, () -> "denied"));

        assertThrows(TimeoutException.class, () -> blocked.get(200, TimeUnit.MILLISECONDS));
        blocked.cancel(true);
    }

    @Test
    void shouldAdmitBatchLargerThanTokenCapacity() {
        assertThat(limiter.execute("oversized", TPM_LIMIT * 5, () -> "admitted")).isEqualTo("admitted");
    }

    @Test
    void shouldIsolateLimitsByKey() {
        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.acquire("key-a", 1);
        }

        CompletableFuture<String> independent = CompletableFuture.supplyAsync(() ->
            limiter.execute("key-b", 1, () -> "success"));

        assertThat(independent.join()).isEqualTo("success");
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new InMemoryDualRateLimiter(0, TPM_LIMIT))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InMemoryDualRateLimiter(RPM_LIMIT, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
