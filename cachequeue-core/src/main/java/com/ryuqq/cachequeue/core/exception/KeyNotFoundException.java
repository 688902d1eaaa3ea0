package com.ryuqq.cachequeue.core.exception;

/**
 * Key is absent or its entry has expired.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class KeyNotFoundException extends CacheException {

    private final String key;

    public KeyNotFoundException(String key) {
        super(CacheErrorCode.NOT_FOUND, key + " not exist");
        this.key = key;
    }

    public String key() {
        return key;
    }
}
