/**
 * Contract tests every {@link com.ryuqq.cachequeue.core.spi.CacheAdapter} must pass.
 *
 * <p>Each abstract class covers one capability; an adapter module extends them in its own
 * test tree and supplies {@code createAdapter}.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
package com.ryuqq.cachequeue.testkit.contract;
