package com.ryuqq.cachequeue.testkit.contract;

import com.ryuqq.cachequeue.core.exception.CacheErrorCode;
import com.ryuqq.cachequeue.core.exception.CacheException;
import com.ryuqq.cachequeue.core.exception.LockContentionException;
import com.ryuqq.cachequeue.core.exception.LockNotHeldException;
import com.ryuqq.cachequeue.core.exception.LockNotSupportedException;
import com.ryuqq.cachequeue.core.model.Lock;
import com.ryuqq.cachequeue.core.model.LockOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Contract Test for distributed locking.
 *
 * <p>Backends without locking must reject every call with
 * {@link CacheErrorCode#UNSUPPORTED_OPERATION}; backends with locking must give
 * exclusive, token-checked locks.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public abstract class LockContractTest extends AbstractAdapterContractTest {

    /**
     * @return whether the adapter under test supports {@code lock}
     */
    protected abstract boolean supportsLocking();

    @Test
    void testLock_Unsupported_AlwaysThrows() {
        assumeFalse(supportsLocking());

        // When & Then
        CacheException exception = assertThrows(LockNotSupportedException.class,
            () -> adapter.lock("resource", 10, LockOptions.defaults()));
        assertEquals(CacheErrorCode.UNSUPPORTED_OPERATION, exception.errorCode());
        assertEquals(adapter.name() + " not support lock", exception.getMessage());

        assertThrows(LockNotSupportedException.class, () -> adapter.lock("resource", 10, null));
    }

    @Test
    void testLock_Supported_ExclusiveUntilReleased() {
        assumeTrue(supportsLocking());

        // Given
        Lock lock = adapter.lock("resource", 10, LockOptions.defaults().withMetadata("owner-1"));
        assertEquals("owner-1", lock.metadata());

        // When & Then
        assertThrows(LockContentionException.class, () -> adapter.lock("resource", 10, LockOptions.defaults()));

        lock.release();
        Lock second = adapter.lock("resource", 10, null);
        assertNotEquals(lock.token(), second.token());
        second.release();
    }

    @Test
    void testLock_Supported_ReleaseTwiceThrowsNotHeld() {
        assumeTrue(supportsLocking());

        // Given
        Lock lock = adapter.lock("resource-2", 10, null);
        lock.release();

        // When & Then
        assertThrows(LockNotHeldException.class, lock::release);
    }
}
