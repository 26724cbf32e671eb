package com.kbengine.infra;

import java.util.function.Supplier;

/**
 * Keyed budget. Callers block in {@link #acquire} until the work they are about to do fits the budget.
 */
public interface RateLimiter {

    void acquire(String key, int permits);

    default <T> T execute(String key, int permits, Supplier<T> task) {
        acquire(key, permits);
        return task.get();
    }
}
