package com.ryuqq.cachequeue.adapter.inmemory.queue;

import com.ryuqq.cachequeue.core.model.Message;

/**
 * Message removed from its stream after failed deliveries.
 *
 * <p><strong>DLQ Entry Contents:</strong></p>
 * <ul>
 *   <li>message: original message (same id as delivered)</li>
 *   <li>deliveryAttempts: how many times the handler saw it</li>
 *   <li>reason: why it was not requeued, with the last handler error</li>
 *   <li>deadAt: when it was moved here (epoch millis)</li>
 * </ul>
 *
 * @param message failed message
 * @param deliveryAttempts number of failed deliveries
 * @param reason cause summary
 * @param deadAt epoch millis
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record DeadLetter(
    Message message,
    int deliveryAttempts,
    String reason,
    long deadAt
) {
}
