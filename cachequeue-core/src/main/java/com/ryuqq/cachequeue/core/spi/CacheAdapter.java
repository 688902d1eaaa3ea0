package com.ryuqq.cachequeue.core.spi;

/**
 * Unified backend contract: key-value store, message queue and lock in one capability set.
 *
 * <p>Every backend implements this interface directly; there is no shared base class.
 * Callers depend on CacheAdapter only and can swap the in-process backend for the
 * networked one without code changes.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * CacheAdapter cache = ...;
 * cache.connect();
 * cache.register("orders", message -&gt; process(message));
 * cache.append(Message.of("orders", Map.of("orderId", 42)));
 * cache.run();      // blocks until shutdown()
 * </pre>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public interface CacheAdapter extends KeyValueStore, MessageQueue, Locker {

    /**
     * @return backend name ("memory", "redis")
     */
    String name();

    /**
     * Prepares the backend for use. Must be called before any other operation.
     *
     * @throws com.ryuqq.cachequeue.core.exception.BackendException if the backend is unreachable
     */
    void connect();

    /**
     * Sets the namespace prepended to every item key (not to stream names).
     *
     * @param prefix key prefix, empty for none
     * @throws IllegalArgumentException if prefix is null
     */
    void setPrefix(String prefix);
}
