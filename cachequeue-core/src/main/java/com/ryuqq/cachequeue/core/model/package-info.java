/**
 * Value objects exchanged through the cache-and-queue contract.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cachequeue.core.model.Message} - unit of work on a stream</li>
 *   <li>{@link com.ryuqq.cachequeue.core.model.MessageHandler} - consumer callback</li>
 *   <li>{@link com.ryuqq.cachequeue.core.model.Lock} - distributed lock handle</li>
 *   <li>{@link com.ryuqq.cachequeue.core.model.LockOptions} /
 *       {@link com.ryuqq.cachequeue.core.model.RetryStrategy} - lock acquisition policy</li>
 *   <li>{@link com.ryuqq.cachequeue.core.model.ShutdownSignal} - run/shutdown token</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cachequeue Team
 */
package com.ryuqq.cachequeue.core.model;
