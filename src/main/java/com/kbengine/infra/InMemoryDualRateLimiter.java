package com.kbengine.infra;

import io.github.bucket4j.Bucket;
import lombok.SneakyThrows;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute and tokens-per-minute limits per key. Callers block until both buckets allow the call.
 */
public class InMemoryDualRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> requestBuckets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bucket> tokenBuckets = new ConcurrentHashMap<>();

    private final int requestsPerMinute;
    private final int tokensPerMinute;

    public InMemoryDualRateLimiter(int requestsPerMinute, int tokensPerMinute) {
        if (requestsPerMinute <= 0 || tokensPerMinute <= 0) {
            throw new IllegalArgumentException("Rate limits must be positive");
        }
        this.requestsPerMinute = requestsPerMinute;
        this.tokensPerMinute = tokensPerMinute;
    }

    private static Bucket perMinute(int capacity) {
        return Bucket.builder()
            .addLimit(limit -> limit.capacity(capacity).refillGreedy(capacity, Duration.ofMinutes(1)))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int tokens) {
        Bucket requests = requestBuckets.computeIfAbsent(key, k -> perMinute(requestsPerMinute));
        Bucket tokenBucket = tokenBuckets.computeIfAbsent(key, k -> perMinute(tokensPerMinute));

        requests.asBlocking().consume(1);
        // capped at the bucket capacity
        tokenBucket.asBlocking().consume(Math.max(1, Math.min(tokens, tokensPerMinute)));
    }
}
