package com.ryuqq.cachequeue.core.model;

import java.time.Duration;

/**
 * Handle for an obtained distributed lock.
 *
 * <p>The lock expires on its own after its TTL unless refreshed. Owners should
 * {@link #release()} as soon as the critical section ends.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public interface Lock {

    /**
     * @return locked key
     */
    String key();

    /**
     * @return random owner token written as the key's value
     */
    String token();

    /**
     * @return metadata supplied through {@link LockOptions}, empty when none
     */
    String metadata();

    /**
     * Returns the remaining time to live.
     *
     * @return remaining TTL, {@link Duration#ZERO} once the lock is no longer held
     * @throws com.ryuqq.cachequeue.core.exception.BackendException on engine failure
     */
    Duration ttl();

    /**
     * Extends the lock to the given TTL.
     *
     * @param ttl new time to live (positive)
     * @throws com.ryuqq.cachequeue.core.exception.LockNotHeldException if the lock was lost
     */
    void refresh(Duration ttl);

    /**
     * Releases the lock.
     *
     * @throws com.ryuqq.cachequeue.core.exception.LockNotHeldException if the lock was lost
     */
    void release();
}
