package com.ryuqq.cachequeue.core.value;

/**
 * Boolean flag, encoded as {@code "true"} or {@code "false"}.
 *
 * @param value flag
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record BooleanValue(boolean value) implements CacheValue {

    @Override
    public String encode() {
        return Boolean.toString(value);
    }
}
