package com.ryuqq.cachequeue.core.exception;

/**
 * Lock is held by another owner and the retry strategy gave up.
 *
 * <p>Callers may retry with their own backoff; the policy is theirs.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class LockContentionException extends CacheException {

    private final String key;

    public LockContentionException(String key) {
        super(CacheErrorCode.LOCK_CONTENTION, "lock not obtained: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
