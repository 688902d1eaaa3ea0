package com.ryuqq.cachequeue.core.spi;

import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.MessageHandler;

/**
 * Stream-based work queue SPI.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Appending messages to named streams</li>
 *   <li>Binding handlers to streams</li>
 *   <li>Running consumers until shutdown</li>
 * </ul>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>At-least-once: a message whose handler throws is delivered again with the same id</li>
 *   <li>Shared work queue: with several handlers on one stream each message goes to exactly
 *       one of them (no broadcast)</li>
 *   <li>No delivery confirmation to the producer</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public interface MessageQueue {

    /**
     * Appends a message to {@code message.stream()}.
     *
     * <p>This method is non-blocking: it returns once the message is accepted, before any
     * consumer sees it. A fresh id is assigned; any id on the argument is ignored.</p>
     *
     * @param message message to enqueue
     * @return id assigned to the enqueued copy
     * @throws IllegalArgumentException if message is null
     * @throws IllegalStateException if the backend has been shut down
     */
    String append(Message message);

    /**
     * Binds a handler to a stream.
     *
     * <p>Each call adds one competing consumer. Registering twice under the same name
     * splits the stream's messages between the two handlers.</p>
     *
     * @param streamName stream to consume
     * @param handler callback invoked per message
     * @throws IllegalArgumentException if streamName is blank or handler is null
     * @throws IllegalStateException if the backend has been shut down
     */
    void register(String streamName, MessageHandler handler);

    /**
     * Blocks the calling thread until {@link #shutdown()} is invoked.
     *
     * <p>An interrupt ends the wait early and restores the interrupt flag.</p>
     */
    void run();

    /**
     * Releases {@link #run()} and stops all consumers. Idempotent.
     */
    void shutdown();
}
