package com.ryuqq.cachequeue.adapter.inmemory.queue;

import com.ryuqq.cachequeue.core.model.Message;

/**
 * Message in flight through a stream, with its delivery attempt number (1-based).
 *
 * @param message the message (id already assigned)
 * @param attempt delivery attempt this hand-off represents
 */
record Delivery(Message message, int attempt) {

    Delivery next() {
        return new Delivery(message, attempt + 1);
    }
}
