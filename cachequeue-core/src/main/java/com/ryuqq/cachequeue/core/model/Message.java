package com.ryuqq.cachequeue.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of work travelling through a stream.
 *
 * <p>The {@code id} is assigned by the producer when the message is appended; whatever id
 * the caller puts here is replaced. Handlers should deduplicate by id because delivery is
 * at-least-once.</p>
 *
 * <p><strong>불변성:</strong> values는 생성 시 복사되며 수정 불가</p>
 *
 * <p><strong>Reserved field:</strong> {@code values["prefix"]} carries a tenant namespace,
 * see {@link #prefix()} and {@link #withPrefix(String)}.</p>
 *
 * @param id delivery identifier (null until appended)
 * @param stream originating stream name (not blank)
 * @param values payload fields (null values allowed)
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record Message(
    String id,
    String stream,
    Map<String, Object> values
) {

    /**
     * Reserved values key used for multi-tenant namespacing.
     */
    public static final String PREFIX_KEY = "prefix";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if stream is null or blank
     */
    public Message {
        if (stream == null || stream.isBlank()) {
            throw new IllegalArgumentException("stream cannot be null or blank");
        }
        values = values == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Creates an unassigned message (id is set on append).
     *
     * @param stream stream name
     * @param values payload fields
     * @return message without id
     */
    public static Message of(String stream, Map<String, Object> values) {
        return new Message(null, stream, values);
    }

    /**
     * Returns a copy carrying the given delivery id.
     *
     * @param id delivery id
     * @return new message
     */
    public Message withId(String id) {
        return new Message(id, stream, values);
    }

    /**
     * Returns the tenant prefix.
     *
     * @return prefix, or an empty string when unset or not a string
     */
    public String prefix() {
        Object prefix = values.get(PREFIX_KEY);
        return prefix instanceof String s ? s : "";
    }

    /**
     * Returns a copy whose {@code values["prefix"]} is set to the given prefix.
     *
     * @param prefix tenant prefix
     * @return new message
     */
    public Message withPrefix(String prefix) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(PREFIX_KEY, prefix);
        return new Message(id, stream, copy);
    }
}
