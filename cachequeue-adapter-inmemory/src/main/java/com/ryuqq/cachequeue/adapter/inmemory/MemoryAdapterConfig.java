package com.ryuqq.cachequeue.adapter.inmemory;

/**
 * Configuration for {@link MemoryCacheAdapter} (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>streamCapacity: buffer capacity per stream (default 0 = unbounded)</li>
 *   <li>maxDeliveryAttempts: maximum deliveries per message (default 0 = unlimited)</li>
 *   <li>receivePollIntervalMs: interval at which dispatchers check for shutdown (default 50ms)</li>
 * </ul>
 *
 * <p>A message that reaches maxDeliveryAttempts is moved to dead letters instead of being requeued.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 * @param streamCapacity buffer capacity (0 or more, 0 = unbounded)
 * @param maxDeliveryAttempts maximum deliveries (0 or more, 0 = unlimited)
 * @param receivePollIntervalMs receive polling interval (milliseconds, must be positive)
 */
public record MemoryAdapterConfig(
    int streamCapacity,
    int maxDeliveryAttempts,
    long receivePollIntervalMs
) {

    /**
     * Default configuration constructor.
     *
     * <p>Defaults: streamCapacity=0, maxDeliveryAttempts=0, receivePollIntervalMs=50ms</p>
     */
    public MemoryAdapterConfig() {
        this(0, 0, 50);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public MemoryAdapterConfig {
        if (streamCapacity < 0) {
            throw new IllegalArgumentException(
                "streamCapacity cannot be negative (current: " + streamCapacity + ")"
            );
        }
        if (maxDeliveryAttempts < 0) {
            throw new IllegalArgumentException(
                "maxDeliveryAttempts cannot be negative (current: " + maxDeliveryAttempts + ")"
            );
        }
        if (receivePollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "receivePollIntervalMs must be positive (current: " + receivePollIntervalMs + ")"
            );
        }
    }

    public MemoryAdapterConfig withStreamCapacity(int streamCapacity) {
        return new MemoryAdapterConfig(streamCapacity, maxDeliveryAttempts, receivePollIntervalMs);
    }

    public MemoryAdapterConfig withMaxDeliveryAttempts(int maxDeliveryAttempts) {
        return new MemoryAdapterConfig(streamCapacity, maxDeliveryAttempts, receivePollIntervalMs);
    }

    public MemoryAdapterConfig withReceivePollIntervalMs(long receivePollIntervalMs) {
        return new MemoryAdapterConfig(streamCapacity, maxDeliveryAttempts, receivePollIntervalMs);
    }
}
