package com.ryuqq.cachequeue.adapter.inmemory.contract;

import com.ryuqq.cachequeue.adapter.inmemory.MemoryAdapterConfig;
import com.ryuqq.cachequeue.adapter.inmemory.MemoryCacheAdapter;
import com.ryuqq.cachequeue.core.model.ShutdownSignal;
import com.ryuqq.cachequeue.core.spi.CacheAdapter;
import com.ryuqq.cachequeue.testkit.contract.LockContractTest;
import com.ryuqq.cachequeue.testkit.contract.MutableClock;

/**
 * {@link LockContractTest} bound to {@link MemoryCacheAdapter}, which has no locking.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
class MemoryLockContractTest extends LockContractTest {

    @Override
    protected CacheAdapter createAdapter(ShutdownSignal signal, MutableClock clock) {
        return new MemoryCacheAdapter(new MemoryAdapterConfig(), signal, clock);
    }

    @Override
    protected boolean supportsLocking() {
        return false;
    }
}
