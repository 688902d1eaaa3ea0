/**
 * In-process cache-and-queue backend.
 *
 * <p>{@link com.ryuqq.cachequeue.adapter.inmemory.MemoryCacheAdapter} composes the
 * {@link com.ryuqq.cachequeue.adapter.inmemory.store item store} and the
 * {@link com.ryuqq.cachequeue.adapter.inmemory.queue stream registry}. Single JVM only;
 * nothing survives a restart.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
package com.ryuqq.cachequeue.adapter.inmemory;
