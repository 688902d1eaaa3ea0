package com.ryuqq.cachequeue.core.exception;

/**
 * Stored value is not usable by a counter operation.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class ValueTypeException extends CacheException {

    private final String key;

    public ValueTypeException(String key, String message) {
        this(key, message, null);
    }

    public ValueTypeException(String key, String message, Throwable cause) {
        super(CacheErrorCode.TYPE_ERROR, message, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
