package com.ryuqq.cachequeue.core.exception;

/**
 * Distributed locking requested from a backend that cannot provide it.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class LockNotSupportedException extends CacheException {

    public LockNotSupportedException(String backend) {
        super(CacheErrorCode.UNSUPPORTED_OPERATION, backend + " not support lock");
    }
}
