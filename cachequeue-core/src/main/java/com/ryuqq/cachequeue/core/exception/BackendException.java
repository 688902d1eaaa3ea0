package com.ryuqq.cachequeue.core.exception;

/**
 * Failure inside the backend itself: connection loss, engine error, interrupted call.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class BackendException extends CacheException {

    public BackendException(String message) {
        super(CacheErrorCode.BACKEND_ERROR, message);
    }

    public BackendException(String message, Throwable cause) {
        super(CacheErrorCode.BACKEND_ERROR, message, cause);
    }
}
