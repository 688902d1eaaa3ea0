package com.ryuqq.cachequeue.adapter.inmemory.contract;

import com.ryuqq.cachequeue.adapter.inmemory.MemoryAdapterConfig;
import com.ryuqq.cachequeue.adapter.inmemory.MemoryCacheAdapter;
import com.ryuqq.cachequeue.core.model.ShutdownSignal;
import com.ryuqq.cachequeue.core.spi.CacheAdapter;
import com.ryuqq.cachequeue.testkit.contract.KeyValueContractTest;
import com.ryuqq.cachequeue.testkit.contract.MutableClock;

/**
 * {@link KeyValueContractTest} bound to {@link MemoryCacheAdapter}.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
class MemoryKeyValueContractTest extends KeyValueContractTest {

    @Override
    protected CacheAdapter createAdapter(ShutdownSignal signal, MutableClock clock) {
        return new MemoryCacheAdapter(new MemoryAdapterConfig(), signal, clock);
    }
}
