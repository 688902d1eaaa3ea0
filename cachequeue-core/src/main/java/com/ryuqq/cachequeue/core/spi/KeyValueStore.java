package com.ryuqq.cachequeue.core.spi;

import com.ryuqq.cachequeue.core.value.CacheValue;

import java.time.Duration;

/**
 * Key-value SPI: string values with expiration, hash fields and counters.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Storing values under a key with a time to live</li>
 *   <li>Reading values back, treating expired entries as absent</li>
 *   <li>Hash-field access</li>
 *   <li>Atomic increment/decrement of integer values</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Per-key linearizable counters: concurrent increase/decrease never lose an update</li>
 *   <li>No resurrection: once a read reports an expired key as absent, it stays absent
 *       until written again</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * store.set("ctr", CacheValue.of(10), 60);
 * store.increase("ctr");          // 11
 * store.decrease("ctr");          // 10
 * store.expire("ctr", Duration.ofSeconds(5));
 * String value = store.get("ctr"); // "10"
 * </pre>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public interface KeyValueStore {

    /**
     * Reads the value stored under key.
     *
     * <p>Implementations that evict lazily delete the expired entry as a side effect.</p>
     *
     * @param key the key
     * @return stored string value
     * @throws com.ryuqq.cachequeue.core.exception.KeyNotFoundException if absent or expired
     * @throws IllegalArgumentException if key is null
     */
    String get(String key);

    /**
     * Stores value under key, replacing any existing entry.
     *
     * <p><strong>TTL:</strong></p>
     * <ul>
     *   <li>ttlSeconds &gt; 0: entry expires ttlSeconds after the call</li>
     *   <li>ttlSeconds = 0: entry never expires</li>
     * </ul>
     *
     * @param key the key
     * @param value typed value, stored in its {@link CacheValue#encode() encoded} form
     * @param ttlSeconds time to live in seconds
     * @throws IllegalArgumentException if key or value is null, or ttlSeconds is negative
     */
    void set(String key, CacheValue value, int ttlSeconds);

    /**
     * Coerces value with {@link CacheValue#from(Object)} and stores it.
     *
     * @param key the key
     * @param value value of a supported type
     * @param ttlSeconds time to live in seconds (0 = no expiry)
     * @throws com.ryuqq.cachequeue.core.exception.ValueEncodingException if value has no string form
     * @throws IllegalArgumentException if key is null or ttlSeconds is negative
     */
    default void set(String key, Object value, int ttlSeconds) {
        set(key, CacheValue.from(value), ttlSeconds);
    }

    /**
     * Removes key. Idempotent: removing an absent key is not an error.
     *
     * @param key the key
     * @throws IllegalArgumentException if key is null
     */
    void del(String key);

    /**
     * Reads one field of a hash.
     *
     * @param hashName hash key
     * @param field field name
     * @return field value
     * @throws com.ryuqq.cachequeue.core.exception.KeyNotFoundException if absent or expired
     * @throws IllegalArgumentException if hashName or field is null
     */
    String hashGet(String hashName, String field);

    /**
     * Removes one field of a hash. Idempotent.
     *
     * @param hashName hash key
     * @param field field name
     * @throws IllegalArgumentException if hashName or field is null
     */
    void hashDel(String hashName, String field);

    /**
     * Atomically adds one to the integer stored under key.
     *
     * @param key the key
     * @return value after the increment
     * @throws com.ryuqq.cachequeue.core.exception.KeyNotFoundException if absent or expired
     * @throws com.ryuqq.cachequeue.core.exception.ValueTypeException if the value is not an integer
     *         or the result would overflow
     * @throws IllegalArgumentException if key is null
     */
    long increase(String key);

    /**
     * Atomically subtracts one from the integer stored under key.
     *
     * @param key the key
     * @return value after the decrement
     * @throws com.ryuqq.cachequeue.core.exception.KeyNotFoundException if absent or expired
     * @throws com.ryuqq.cachequeue.core.exception.ValueTypeException if the value is not an integer
     *         or the result would overflow
     * @throws IllegalArgumentException if key is null
     */
    long decrease(String key);

    /**
     * Resets the time to live of an existing key, keeping its value.
     *
     * <p>A zero or negative duration expires the key immediately.</p>
     *
     * @param key the key
     * @param duration new time to live, counted from now
     * @throws com.ryuqq.cachequeue.core.exception.KeyNotFoundException if absent or expired
     * @throws IllegalArgumentException if key or duration is null
     */
    void expire(String key, Duration duration);
}
