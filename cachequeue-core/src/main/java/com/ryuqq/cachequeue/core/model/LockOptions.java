package com.ryuqq.cachequeue.core.model;

/**
 * Options for obtaining a lock.
 *
 * @param retryStrategy backoff while the lock is contended
 * @param metadata free-form text kept on the handle (not null)
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record LockOptions(
    RetryStrategy retryStrategy,
    String metadata
) {

    private static final LockOptions DEFAULTS = new LockOptions(RetryStrategy.noRetry(), "");

    public LockOptions {
        if (retryStrategy == null) {
            throw new IllegalArgumentException("retryStrategy cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
    }

    /**
     * No retry, no metadata.
     */
    public static LockOptions defaults() {
        return DEFAULTS;
    }

    public LockOptions withRetryStrategy(RetryStrategy retryStrategy) {
        return new LockOptions(retryStrategy, metadata);
    }

    public LockOptions withMetadata(String metadata) {
        return new LockOptions(retryStrategy, metadata);
    }
}
