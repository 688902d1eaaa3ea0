package com.ryuqq.cachequeue.adapter.inmemory.store;

import com.ryuqq.cachequeue.core.exception.KeyNotFoundException;
import com.ryuqq.cachequeue.core.exception.ValueTypeException;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrent key → value+expiry store with read-triggered eviction.
 *
 * <p>This implementation keeps every entry in a single {@link ConcurrentHashMap}. Expired
 * entries are never swept in the background; they are removed by the next operation that
 * touches their key.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>items:</strong> ConcurrentHashMap&lt;String, Entry&gt; - value and absolute expiry (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Concurrency Guarantees:</strong></p>
 * <ul>
 *   <li><strong>get:</strong> eviction uses {@code remove(key, staleEntry)}; Entry has identity
 *       equality, so a set that lands between the expiry check and the removal survives</li>
 *   <li><strong>increase/decrease:</strong> read-parse-add-write runs inside
 *       {@code ConcurrentHashMap.compute}, which holds the key's bin lock for the whole
 *       sequence (per-key linearizable, no lost updates)</li>
 *   <li><strong>expire:</strong> {@code computeIfPresent}, same per-key atomicity</li>
 *   <li><strong>set/del:</strong> single atomic map operations</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Single JVM only</li>
 *   <li>Hash fields share the flat key space: {@code hashGet("a", "")} reads key {@code "a"}</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public class InMemoryItemStore {

    private final ConcurrentHashMap<String, Entry> items;
    private final Clock clock;

    /**
     * Creates a store on the system clock.
     */
    public InMemoryItemStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store on a custom clock (tests drive expiry with it).
     *
     * @param clock time source for expiry
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryItemStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.items = new ConcurrentHashMap<>();
        this.clock = clock;
    }

    /**
     * Reads a value, evicting it if it has expired.
     *
     * @param key the key
     * @return stored value
     * @throws KeyNotFoundException if absent or expired
     */
    public String get(String key) {
        requireKey(key);
        Entry entry = items.get(key);
        if (entry == null) {
            throw new KeyNotFoundException(key);
        }
        if (entry.isExpiredAt(clock.millis())) {
            // compare-and-delete: only the stale reference we observed
            items.remove(key, entry);
            throw new KeyNotFoundException(key);
        }
        return entry.value;
    }

    /**
     * Stores a value, replacing any existing entry.
     *
     * @param key the key
     * @param value encoded value
     * @param ttlSeconds time to live in seconds, 0 for no expiry
     * @throws IllegalArgumentException if key or value is null, or ttlSeconds is negative
     */
    public void set(String key, String value, int ttlSeconds) {
        requireKey(key);
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds cannot be negative, but was: " + ttlSeconds);
        }

        long expiresAt = ttlSeconds == 0
            ? Entry.NEVER
            : clock.millis() + ttlSeconds * 1000L;
        items.put(key, new Entry(value, expiresAt));
    }

    /**
     * Removes a key. Idempotent.
     *
     * @param key the key
     */
    public void del(String key) {
        requireKey(key);
        items.remove(key);
    }

    /**
     * Reads a hash field, stored under the concatenated key {@code hashName + field}.
     */
    public String hashGet(String hashName, String field) {
        return get(hashKey(hashName, field));
    }

    /**
     * Removes a hash field stored under {@code hashName + field}.
     */
    public void hashDel(String hashName, String field) {
        del(hashKey(hashName, field));
    }

    /**
     * Atomically adds one.
     *
     * @param key the key
     * @return new value
     * @throws KeyNotFoundException if absent or expired
     * @throws ValueTypeException if the value is not a base-10 long or would overflow
     */
    public long increase(String key) {
        return calculate(key, 1);
    }

    /**
     * Atomically subtracts one.
     *
     * @param key the key
     * @return new value
     * @throws KeyNotFoundException if absent or expired
     * @throws ValueTypeException if the value is not a base-10 long or would overflow
     */
    public long decrease(String key) {
        return calculate(key, -1);
    }

    /**
     * Resets the expiry of a live key, keeping its value.
     *
     * <p>A zero or negative duration deletes the key. A duration too long to represent
     * as an epoch millisecond keeps the key without expiry.</p>
     *
     * @param key the key
     * @param duration new time to live from now
     * @throws KeyNotFoundException if absent or expired
     */
    public void expire(String key, Duration duration) {
        requireKey(key);
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }

        long now = clock.millis();
        boolean[] found = new boolean[1];
        items.computeIfPresent(key, (k, entry) -> {
            if (entry.isExpiredAt(now)) {
                return null;
            }
            found[0] = true;
            if (duration.isNegative() || duration.isZero()) {
                return null;
            }
            return entry.withExpiresAt(deadline(now, duration));
        });

        if (!found[0]) {
            throw new KeyNotFoundException(key);
        }
    }

    /**
     * Returns the number of physical entries, including expired ones not yet evicted.
     * Used for test assertions.
     *
     * @return entry count
     */
    public int size() {
        return items.size();
    }

    /**
     * Removes every entry. Used for test cleanup.
     */
    public void clear() {
        items.clear();
    }

    private long calculate(String key, long delta) {
        requireKey(key);
        long now = clock.millis();
        long[] updated = new long[1];

        // remapping function이 예외를 던지면 기존 mapping은 그대로 유지됨
        Entry result = items.compute(key, (k, entry) -> {
            if (entry == null || entry.isExpiredAt(now)) {
                return null;
            }
            long next = add(k, parse(k, entry.value), delta);
            updated[0] = next;
            return entry.withValue(Long.toString(next));
        });

        if (result == null) {
            throw new KeyNotFoundException(key);
        }
        return updated[0];
    }

    private static long deadline(long now, Duration duration) {
        try {
            return Math.addExact(now, duration.toMillis());
        } catch (ArithmeticException e) {
            // 표현 불가능한 만료 시각은 무기한으로 취급
            return Entry.NEVER;
        }
    }

    private static long parse(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ValueTypeException(key, "value of " + key + " is not an integer: " + value, e);
        }
    }

    private static long add(String key, long current, long delta) {
        try {
            return Math.addExact(current, delta);
        } catch (ArithmeticException e) {
            throw new ValueTypeException(key, "increment or decrement of " + key + " would overflow", e);
        }
    }

    private static String hashKey(String hashName, String field) {
        if (hashName == null) {
            throw new IllegalArgumentException("hashName cannot be null");
        }
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
        return hashName + field;
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
    }

    /**
     * Stored value plus absolute expiry.
     *
     * <p>Identity equality: {@code remove(key, entry)} deletes only the observed instance.</p>
     */
    private static final class Entry {

        static final long NEVER = Long.MAX_VALUE;

        private final String value;
        private final long expiresAt;

        Entry(String value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        boolean isExpiredAt(long now) {
            return expiresAt < now;
        }

        Entry withValue(String value) {
            return new Entry(value, expiresAt);
        }

        Entry withExpiresAt(long expiresAt) {
            return new Entry(value, expiresAt);
        }
    }
}
