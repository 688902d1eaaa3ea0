package com.ryuqq.cachequeue.core.value;

import com.ryuqq.cachequeue.core.exception.ValueEncodingException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Typed value accepted by {@code set}.
 *
 * <p>CacheValue has five variants, all of which are stored as strings:</p>
 * <ul>
 *   <li>{@link StringValue}: stored as-is</li>
 *   <li>{@link IntegerValue}: base-10 digits, usable by counters</li>
 *   <li>{@link FloatValue}: shortest plain decimal form ("1.5", "3")</li>
 *   <li>{@link BooleanValue}: "true" / "false"</li>
 *   <li>{@link BytesValue}: UTF-8 decoded text (malformed UTF-8 is rejected)</li>
 * </ul>
 *
 * <p>{@link #encode()} is total: every constructed value has a string form.
 * Validation happens on construction: {@link #from(Object)} rejects types with no canonical
 * string form and {@link BytesValue} rejects malformed UTF-8.</p>
 *
 * <p><strong>Pattern Matching 예시:</strong></p>
 * <pre>
 * if (value instanceof IntegerValue integer) {
 *     long n = integer.value();
 * }
 * </pre>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public sealed interface CacheValue permits StringValue, IntegerValue, FloatValue, BooleanValue, BytesValue {

    /**
     * Returns the string form written to the backend.
     *
     * @return encoded value, never null
     */
    String encode();

    static CacheValue of(String value) {
        return new StringValue(value);
    }

    static CacheValue of(long value) {
        return new IntegerValue(value);
    }

    static CacheValue of(double value) {
        return new FloatValue(value);
    }

    static CacheValue of(boolean value) {
        return new BooleanValue(value);
    }

    static CacheValue of(byte[] value) {
        return new BytesValue(value);
    }

    /**
     * Coerces an arbitrary object into a CacheValue.
     *
     * <p>Supported: {@link CacheValue}, {@link CharSequence}, {@link Character},
     * integral numbers ({@code Byte}, {@code Short}, {@code Integer}, {@code Long},
     * {@code AtomicInteger}, {@code AtomicLong}, {@code BigInteger}),
     * {@code Float}, {@code Double}, {@code BigDecimal}, {@code Boolean} and {@code byte[]}.
     * {@code null} becomes the empty string.</p>
     *
     * @param value object to coerce
     * @return typed value
     * @throws ValueEncodingException if value is a non-finite floating point number,
     *                                malformed UTF-8 bytes, or of an unsupported type
     */
    static CacheValue from(Object value) {
        if (value == null) {
            return new StringValue("");
        }
        if (value instanceof CacheValue cacheValue) {
            return cacheValue;
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return new StringValue(value.toString());
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof AtomicInteger || value instanceof AtomicLong) {
            return new IntegerValue(((Number) value).longValue());
        }
        if (value instanceof BigInteger bigInteger) {
            return new StringValue(bigInteger.toString());
        }
        if (value instanceof BigDecimal bigDecimal) {
            return new StringValue(bigDecimal.toPlainString());
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new ValueEncodingException("unable to cast " + value + " to string");
            }
            return new FloatValue(d);
        }
        if (value instanceof Boolean bool) {
            return new BooleanValue(bool);
        }
        if (value instanceof byte[] bytes) {
            return new BytesValue(bytes);
        }
        throw new ValueEncodingException(
                "unable to cast " + value.getClass().getName() + " to string");
    }
}
