package com.ryuqq.cachequeue.core.exception;

/**
 * Root of all backend errors.
 *
 * <p>Unchecked: every failure propagates to the caller immediately, the core never
 * swallows or retries it.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class CacheException extends RuntimeException {

    private final CacheErrorCode errorCode;

    /**
     * Creates an exception without a cause.
     *
     * @param errorCode error category
     * @param message detail message
     * @throws IllegalArgumentException if errorCode is null
     */
    public CacheException(CacheErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    /**
     * Creates an exception wrapping a lower-level cause.
     *
     * @param errorCode error category
     * @param message detail message
     * @param cause underlying failure (nullable)
     * @throws IllegalArgumentException if errorCode is null
     */
    public CacheException(CacheErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * Returns the error category.
     *
     * @return error code
     */
    public CacheErrorCode errorCode() {
        return errorCode;
    }
}
