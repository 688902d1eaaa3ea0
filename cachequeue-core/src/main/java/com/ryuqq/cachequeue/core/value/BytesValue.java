package com.ryuqq.cachequeue.core.value;

import com.ryuqq.cachequeue.core.exception.ValueEncodingException;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Raw bytes, stored as their UTF-8 text.
 *
 * <p>The array is copied on the way in and out. Only well-formed UTF-8 is accepted so that
 * the stored string reads back as the same bytes.</p>
 *
 * @param value bytes (not null, valid UTF-8)
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record BytesValue(byte[] value) implements CacheValue {

    /**
     * @throws IllegalArgumentException if value is null
     * @throws ValueEncodingException if value is not well-formed UTF-8
     */
    public BytesValue {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        value = value.clone();
        decode(value);
    }

    @Override
    public byte[] value() {
        return value.clone();
    }

    @Override
    public String encode() {
        return decode(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(value, ((BytesValue) o).value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "BytesValue{" + value.length + " bytes}";
    }

    private static String decode(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
        } catch (CharacterCodingException e) {
            throw new ValueEncodingException("unable to cast " + bytes.length + " bytes to string: not valid UTF-8");
        }
    }
}
