package com.ryuqq.cachequeue.core.model;

/**
 * Consumer callback bound to a stream with {@code register}.
 *
 * <p>Returning normally acknowledges the message. Throwing any exception marks the
 * delivery as failed and the backend redelivers the same message (same id) later.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Processes one message.
     *
     * @param message delivered message, owned by the handler until it returns
     * @throws Exception to request redelivery
     */
    void handle(Message message) throws Exception;
}
