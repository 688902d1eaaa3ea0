/**
 * Error taxonomy of the cache-and-queue contract.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.ryuqq.cachequeue.core.exception.CacheException}, which carries a
 * {@link com.ryuqq.cachequeue.core.exception.CacheErrorCode}. Argument validation errors
 * (null keys, negative TTLs) are reported with {@link java.lang.IllegalArgumentException}
 * instead.</p>
 *
 * @since 1.0.0
 * @author Cachequeue Team
 */
package com.ryuqq.cachequeue.core.exception;
