/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the contract every cache-and-queue backend implements.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cachequeue.core.spi.KeyValueStore} - values, expiry, hash fields, counters</li>
 *   <li>{@link com.ryuqq.cachequeue.core.spi.MessageQueue} - streams, consumers, run/shutdown</li>
 *   <li>{@link com.ryuqq.cachequeue.core.spi.Locker} - distributed lock</li>
 *   <li>{@link com.ryuqq.cachequeue.core.spi.CacheAdapter} - all of the above plus lifecycle</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (cachequeue-adapter-inmemory, cachequeue-adapter-redis) provide the
 * concrete implementations and must pass the contract tests in cachequeue-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Composition over inheritance:</strong> backends share no base class</li>
 *   <li><strong>Pluggability:</strong> In-memory for tests and single-process use, Redis for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cachequeue Team
 */
package com.ryuqq.cachequeue.core.spi;
