/**
 * In-memory item store: values, expiry, hash fields and counters.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.cachequeue.adapter.inmemory.store.InMemoryItemStore}:
 *       Thread-safe key → value+expiry map with read-triggered eviction</li>
 * </ul>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Lazy expiry:</strong> no sweeper thread; the next access evicts</li>
 *   <li><strong>Per-key atomicity:</strong> counters and expire run inside
 *       {@link java.util.concurrent.ConcurrentHashMap#compute}</li>
 *   <li><strong>No global lock:</strong> operations on different keys never contend</li>
 * </ul>
 *
 * @see com.ryuqq.cachequeue.core.spi.KeyValueStore
 * @author Cachequeue Team
 * @since 1.0.0
 */
package com.ryuqq.cachequeue.adapter.inmemory.store;
