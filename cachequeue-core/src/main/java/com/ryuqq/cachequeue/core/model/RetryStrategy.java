package com.ryuqq.cachequeue.core.model;

import java.time.Duration;

/**
 * Backoff policy used while waiting for a contended lock.
 *
 * <p>Strategies are stateless functions of the attempt number, so one instance can be
 * shared by any number of lock calls.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RetryStrategy.limitRetry(RetryStrategy.linearBackoff(Duration.ofMillis(100)), 3)
 *   attempt=0: 100ms
 *   attempt=1: 100ms
 *   attempt=2: 100ms
 *   attempt=3: STOP
 * </pre>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryStrategy {

    /**
     * Sentinel returned by {@link #nextBackoffMs(int)} to give up.
     */
    long STOP = -1L;

    /**
     * Returns how long to wait before the next attempt.
     *
     * @param attempt number of retries already made (0 for the first retry)
     * @return wait in milliseconds, or {@link #STOP}
     */
    long nextBackoffMs(int attempt);

    /**
     * Never retries.
     */
    static RetryStrategy noRetry() {
        return attempt -> STOP;
    }

    /**
     * Retries forever with a fixed pause.
     *
     * @param backoff pause between attempts (positive)
     * @throws IllegalArgumentException if backoff is null or not positive
     */
    static RetryStrategy linearBackoff(Duration backoff) {
        if (backoff == null || backoff.isNegative() || backoff.isZero()) {
            throw new IllegalArgumentException("backoff must be positive (current: " + backoff + ")");
        }
        long backoffMs = backoff.toMillis();
        return attempt -> backoffMs;
    }

    /**
     * Retries forever, doubling the pause from min up to max.
     *
     * @param min first pause (positive)
     * @param max cap (at least min)
     * @throws IllegalArgumentException if min is not positive or max is below min
     */
    static RetryStrategy exponentialBackoff(Duration min, Duration max) {
        if (min == null || min.isNegative() || min.isZero()) {
            throw new IllegalArgumentException("min must be positive (current: " + min + ")");
        }
        if (max == null || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("max must be >= min (min: " + min + ", max: " + max + ")");
        }
        long minMs = min.toMillis();
        long maxMs = max.toMillis();
        return attempt -> {
            // overflow 방지를 위해 shift 상한 적용
            int shift = Math.min(attempt, 30);
            return Math.min(minMs << shift, maxMs);
        };
    }

    /**
     * Caps another strategy at a maximum number of retries.
     *
     * @param delegate strategy to cap
     * @param maxRetries retries allowed (0 behaves like {@link #noRetry()})
     * @throws IllegalArgumentException if delegate is null or maxRetries is negative
     */
    static RetryStrategy limitRetry(RetryStrategy delegate, int maxRetries) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be non-negative (current: " + maxRetries + ")");
        }
        return attempt -> attempt >= maxRetries ? STOP : delegate.nextBackoffMs(attempt);
    }
}
