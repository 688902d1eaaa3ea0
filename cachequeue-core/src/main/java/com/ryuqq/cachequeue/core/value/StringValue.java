package com.ryuqq.cachequeue.core.value;

/**
 * Plain text value.
 *
 * @param value text (not null, may be empty)
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record StringValue(String value) implements CacheValue {

    public StringValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public String encode() {
        return value;
    }
}
