package com.ryuqq.cachequeue.core.exception;

/**
 * Lock handle no longer owns its key (expired or taken over).
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class LockNotHeldException extends CacheException {

    private final String key;

    public LockNotHeldException(String key) {
        super(CacheErrorCode.LOCK_NOT_HELD, "lock not held: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
