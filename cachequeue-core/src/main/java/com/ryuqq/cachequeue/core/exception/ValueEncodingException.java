package com.ryuqq.cachequeue.core.exception;

/**
 * Value has no canonical string form and cannot be stored.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class ValueEncodingException extends CacheException {

    public ValueEncodingException(String message) {
        super(CacheErrorCode.ENCODING_ERROR, message);
    }

    public ValueEncodingException(String message, Throwable cause) {
        super(CacheErrorCode.ENCODING_ERROR, message, cause);
    }
}
