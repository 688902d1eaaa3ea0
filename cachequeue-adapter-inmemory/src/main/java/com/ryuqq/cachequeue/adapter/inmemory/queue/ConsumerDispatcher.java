package com.ryuqq.cachequeue.adapter.inmemory.queue;

import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.MessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Consumer task bound to a single stream.
 *
 * <p>One instance is created per register call and runs on its own dispatcher thread.</p>
 *
 * <p><strong>Processing Flow:</strong></p>
 * <pre>
 * receive() → Delivery
 *   ↓
 * handler.handle(message)
 *   ├─ returns normally → discarded (ACK)
 *   └─ throws (Exception or Error) → onFailure:
 *        - maxDeliveryAttempts reached → dead letter
 *        - stream DRAINING → dead letter
 *        - otherwise → requeued on the same stream (no backoff, same id)
 *   ↓
 * receive() returns null (stream closed and empty) → exit
 * </pre>
 *
 * <p><strong>Fatal errors:</strong> a {@link VirtualMachineError} other than
 * {@link StackOverflowError} dead-letters the message and then propagates, ending the
 * dispatcher. Every other throwable is a handler failure and the dispatcher keeps running.</p>
 *
 * <p><strong>Redelivery Policy:</strong> maxDeliveryAttempts = 0 means unlimited redelivery,
 * so a handler that always fails is retried forever. Set a limit in production.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
final class ConsumerDispatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ConsumerDispatcher.class);

    private final StreamChannel channel;
    private final MessageHandler handler;
    private final int maxDeliveryAttempts;
    private final Consumer<DeadLetter> deadLetterSink;

    /**
     * Constructor.
     *
     * @param channel channel to receive from (consumer already attached)
     * @param handler message handler
     * @param maxDeliveryAttempts maximum deliveries per message (0 = unlimited)
     * @param deadLetterSink receiver of dead letters
     */
    ConsumerDispatcher(StreamChannel channel, MessageHandler handler, int maxDeliveryAttempts,
                       Consumer<DeadLetter> deadLetterSink) {
        this.channel = channel;
        this.handler = handler;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
        this.deadLetterSink = deadLetterSink;
    }

    @Override
    public void run() {
        log.info("Dispatcher started for stream {}", channel.name());
        try {
            Delivery delivery;
            while ((delivery = channel.receive()) != null) {
                dispatch(delivery);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dispatcher for stream {} interrupted", channel.name());
        } finally {
            channel.detachConsumer();
            log.info("Dispatcher stopped for stream {}", channel.name());
        }
    }

    private void dispatch(Delivery delivery) {
        try {
            handler.handle(delivery.message());
        } catch (VirtualMachineError e) {
            if (e instanceof StackOverflowError) {
                onFailure(delivery, e);
                return;
            }
            deadLetter(delivery, "fatal error in handler: " + e);
            throw e;
        } catch (Throwable t) {
            onFailure(delivery, t);
        }
    }

    private void onFailure(Delivery delivery, Throwable error) {
        Message message = delivery.message();
        int attempt = delivery.attempt();

        if (maxDeliveryAttempts > 0 && attempt >= maxDeliveryAttempts) {
            deadLetter(delivery, "delivery attempts exhausted (" + attempt + "): " + error);
            return;
        }
        if (!channel.requeue(delivery.next())) {
            deadLetter(delivery, "stream " + channel.name() + " is " + channel.state() + ": " + error);
            return;
        }
        log.debug("Redelivering {} on stream {} (attempt {} failed: {})",
            message.id(), channel.name(), attempt, error.toString());
    }

    private void deadLetter(Delivery delivery, String reason) {
        Message message = delivery.message();
        deadLetterSink.accept(new DeadLetter(message, delivery.attempt(), reason, System.currentTimeMillis()));
        log.error("Message {} on stream {} moved to dead letters: {}", message.id(), channel.name(), reason);
    }
}
