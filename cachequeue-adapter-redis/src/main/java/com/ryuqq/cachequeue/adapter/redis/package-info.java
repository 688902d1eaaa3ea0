/**
 * Networked cache-and-queue backend on Redis/Valkey through Valkey GLIDE.
 *
 * <h2>Components</h2>
 *
 * <ul>
 *   <li>{@link com.ryuqq.cachequeue.adapter.redis.RedisCacheAdapter}: key-value and queue pass-through</li>
 *   <li>{@code RedisStreamConsumer}: consumer group read loop, at-least-once</li>
 *   <li>{@code RedisLocker} / {@code RedisLock}: single-instance lock with token check</li>
 * </ul>
 *
 * <h2>Error mapping</h2>
 *
 * <ul>
 *   <li>nil reply → {@link com.ryuqq.cachequeue.core.exception.KeyNotFoundException}</li>
 *   <li>non-integer counter → {@link com.ryuqq.cachequeue.core.exception.ValueTypeException}</li>
 *   <li>anything else → {@link com.ryuqq.cachequeue.core.exception.BackendException}</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
package com.ryuqq.cachequeue.adapter.redis;
