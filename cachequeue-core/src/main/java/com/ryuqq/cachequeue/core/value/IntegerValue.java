package com.ryuqq.cachequeue.core.value;

/**
 * Signed 64-bit integer; the only variant counters can read back.
 *
 * @param value integer value
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record IntegerValue(long value) implements CacheValue {

    @Override
    public String encode() {
        return Long.toString(value);
    }
}
