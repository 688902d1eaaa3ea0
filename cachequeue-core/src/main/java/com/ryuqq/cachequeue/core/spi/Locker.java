package com.ryuqq.cachequeue.core.spi;

import com.ryuqq.cachequeue.core.model.Lock;
import com.ryuqq.cachequeue.core.model.LockOptions;

/**
 * Distributed mutual exclusion SPI.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public interface Locker {

    /**
     * Obtains a lock on key.
     *
     * @param key key to lock
     * @param ttlSeconds lock time to live in seconds (positive)
     * @param options retry and metadata options (null = {@link LockOptions#defaults()})
     * @return lock handle
     * @throws com.ryuqq.cachequeue.core.exception.LockNotSupportedException if the backend has no
     *         distributed lock
     * @throws com.ryuqq.cachequeue.core.exception.LockContentionException if the lock stays held by
     *         another owner after the retry strategy gives up
     */
    Lock lock(String key, long ttlSeconds, LockOptions options);
}
