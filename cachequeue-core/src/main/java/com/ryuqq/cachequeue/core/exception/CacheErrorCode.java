package com.ryuqq.cachequeue.core.exception;

/**
 * Error taxonomy shared by every {@link com.ryuqq.cachequeue.core.spi.CacheAdapter} backend.
 *
 * <p>Each code maps to exactly one {@link CacheException} subtype so callers can either
 * catch the subtype or branch on {@link CacheException#errorCode()}.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public enum CacheErrorCode {

    /**
     * Key absent or expired. Recoverable, the caller decides the fallback.
     */
    NOT_FOUND,

    /**
     * Value cannot be turned into its stored string form.
     */
    ENCODING_ERROR,

    /**
     * Counter operation on a value that is not an integer, or the result would overflow.
     */
    TYPE_ERROR,

    /**
     * Operation the backend does not offer (e.g. distributed lock on the in-process backend).
     */
    UNSUPPORTED_OPERATION,

    /**
     * Lock already held by another owner.
     */
    LOCK_CONTENTION,

    /**
     * Lock expired or was taken over before release/refresh.
     */
    LOCK_NOT_HELD,

    /**
     * Engine, network or interruption failure inside the backend.
     */
    BACKEND_ERROR
}
