package com.ryuqq.cachequeue.adapter.inmemory;

import com.ryuqq.cachequeue.adapter.inmemory.queue.DeadLetter;
import com.ryuqq.cachequeue.adapter.inmemory.queue.QueueRegistry;
import com.ryuqq.cachequeue.adapter.inmemory.queue.StreamState;
import com.ryuqq.cachequeue.adapter.inmemory.store.InMemoryItemStore;
import com.ryuqq.cachequeue.core.exception.LockNotSupportedException;
import com.ryuqq.cachequeue.core.model.Lock;
import com.ryuqq.cachequeue.core.model.LockOptions;
import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.MessageHandler;
import com.ryuqq.cachequeue.core.model.ShutdownSignal;
import com.ryuqq.cachequeue.core.spi.CacheAdapter;
import com.ryuqq.cachequeue.core.value.CacheValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * In-process {@link CacheAdapter}.
 *
 * <p>Items live in an {@link InMemoryItemStore}; streams live in a {@link QueueRegistry}.
 * Both are created by {@link #connect()}.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * new → connect() → (set/get/append/register ...) → run() ──blocks──┐
 *                                                   shutdown() ─────┴→ streams drain → STOPPED
 * </pre>
 *
 * <p>{@link #shutdown()} fires the {@link ShutdownSignal}. A signal shared with other
 * components stops this adapter too, whoever fires it.</p>
 *
 * <p>Locking is not available: {@link #lock} always throws {@link LockNotSupportedException}.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public final class MemoryCacheAdapter implements CacheAdapter {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheAdapter.class);

    static final String NAME = "memory";

    private final MemoryAdapterConfig config;
    private final ShutdownSignal signal;
    private final Clock clock;
    private final Object connectLock = new Object();

    private volatile InMemoryItemStore store;
    private volatile QueueRegistry queues;
    private volatile String prefix = "";

    /**
     * Creates an adapter with default settings and a private shutdown signal.
     */
    public MemoryCacheAdapter() {
        this(new MemoryAdapterConfig(), new ShutdownSignal());
    }

    public MemoryCacheAdapter(MemoryAdapterConfig config, ShutdownSignal signal) {
        this(config, signal, Clock.systemUTC());
    }

    /**
     * @param config queue settings
     * @param signal completion signal released by {@link #shutdown()}
     * @param clock time source for item expiry
     * @throws IllegalArgumentException if any argument is null
     */
    public MemoryCacheAdapter(MemoryAdapterConfig config, ShutdownSignal signal, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.signal = signal;
        this.clock = clock;
        signal.onSignal(this::closeQueues);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void connect() {
        synchronized (connectLock) {
            if (signal.isSignaled()) {
                throw new IllegalStateException("memory adapter is shut down");
            }
            if (store != null) {
                return;
            }
            QueueRegistry registry = new QueueRegistry(
                config.streamCapacity(), config.maxDeliveryAttempts(), config.receivePollIntervalMs());
            this.store = new InMemoryItemStore(clock);
            this.queues = registry;
            log.info("Memory adapter connected (streamCapacity={}, maxDeliveryAttempts={})",
                config.streamCapacity(), config.maxDeliveryAttempts());
        }
        // shutdown()이 connect 도중 실행된 경우
        if (signal.isSignaled()) {
            closeQueues();
        }
    }

    @Override
    public void setPrefix(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        this.prefix = prefix;
    }

    // ========== Key-value ==========

    @Override
    public String get(String key) {
        return store().get(prefixed(key));
    }

    @Override
    public void set(String key, CacheValue value, int ttlSeconds) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        store().set(prefixed(key), value.encode(), ttlSeconds);
    }

    @Override
    public void del(String key) {
        store().del(prefixed(key));
    }

    @Override
    public String hashGet(String hashName, String field) {
        return store().hashGet(prefixed(hashName), field);
    }

    @Override
    public void hashDel(String hashName, String field) {
        store().hashDel(prefixed(hashName), field);
    }

    @Override
    public long increase(String key) {
        return store().increase(prefixed(key));
    }

    @Override
    public long decrease(String key) {
        return store().decrease(prefixed(key));
    }

    @Override
    public void expire(String key, Duration duration) {
        store().expire(prefixed(key), duration);
    }

    // ========== Queue ==========

    @Override
    public String append(Message message) {
        return queues().append(message);
    }

    @Override
    public void register(String streamName, MessageHandler handler) {
        queues().register(streamName, handler);
    }

    /**
     * Blocks until {@link #shutdown()} (or any holder of the signal) fires.
     *
     * <p>Dispatchers already run from {@link #register}; this call only parks the caller.
     * An interrupt ends the wait early and keeps the interrupt flag set.</p>
     */
    @Override
    public void run() {
        queues();
        log.info("Memory adapter running");
        try {
            signal.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Memory adapter run() interrupted before shutdown");
            return;
        }
        log.info("Memory adapter run() released by shutdown");
    }

    /**
     * Fires the shutdown signal. Idempotent.
     */
    @Override
    public void shutdown() {
        if (signal.signal()) {
            log.info("Memory adapter shutdown requested");
        }
    }

    // ========== Lock ==========

    @Override
    public Lock lock(String key, long ttlSeconds, LockOptions options) {
        throw new LockNotSupportedException(NAME);
    }

    // ========== Inspection ==========

    /**
     * Waits until every dispatcher has exited after {@link #shutdown()}.
     *
     * @param timeout maximum time to wait
     * @return true if all queue threads finished in time
     * @throws IllegalStateException if shutdown has not been requested
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (timeout == null) {
            throw new IllegalArgumentException("timeout cannot be null");
        }
        return queues().awaitTermination(timeout);
    }

    public List<DeadLetter> deadLetters() {
        return queues().deadLetters();
    }

    public StreamState streamState(String streamName) {
        return queues().state(streamName);
    }

    public Set<String> streamNames() {
        return queues().streamNames();
    }

    private void closeQueues() {
        QueueRegistry registry = this.queues;
        if (registry != null) {
            registry.close();
        }
    }

    private InMemoryItemStore store() {
        InMemoryItemStore current = store;
        if (current == null) {
            throw new IllegalStateException("memory adapter is not connected");
        }
        return current;
    }

    private QueueRegistry queues() {
        QueueRegistry current = queues;
        if (current == null) {
            throw new IllegalStateException("memory adapter is not connected");
        }
        return current;
    }

    private String prefixed(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return prefix + key;
    }
}
