package com.ryuqq.cachequeue.core.value;

import java.math.BigDecimal;

/**
 * Finite double precision number.
 *
 * <p>Encoded in its shortest plain decimal form without exponent or trailing zeros,
 * e.g. {@code 1.50 -> "1.5"}, {@code 3.0 -> "3"}, {@code 1e-7 -> "0.0000001"}.</p>
 *
 * @param value finite number
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record FloatValue(double value) implements CacheValue {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if value is NaN or infinite
     */
    public FloatValue {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("value must be finite (current: " + value + ")");
        }
    }

    @Override
    public String encode() {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
