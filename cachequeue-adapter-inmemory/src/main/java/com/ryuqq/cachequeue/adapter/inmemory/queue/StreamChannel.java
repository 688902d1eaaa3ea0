package com.ryuqq.cachequeue.adapter.inmemory.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process channel for a single stream.
 *
 * <p>The only synchronization point between producers and dispatchers.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>buffer:</strong> BlockingQueue&lt;Delivery&gt; - unbounded when capacity is 0, bounded otherwise</li>
 *   <li><strong>lane:</strong> ConcurrentLinkedQueue&lt;Delivery&gt; - pending appends and requeues (FIFO)</li>
 * </ul>
 *
 * <p><strong>Enqueue Lane:</strong></p>
 * <pre>
 * enqueue(d) → lane.add(d) → (no lane task running) submit drainLane → return immediately
 * drainLane: lane.peek() → buffer.put() (waits here when full) → lane.poll()
 * </pre>
 * <ul>
 *   <li>Callers never wait on a full buffer; only the background task does</li>
 *   <li>At most one lane task per stream, so one thread's append order is the buffer order</li>
 *   <li>A message is always in the lane or the buffer while moving (put before poll)</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
final class StreamChannel {

    private static final Logger log = LoggerFactory.getLogger(StreamChannel.class);

    private final String name;
    private final BlockingQueue<Delivery> buffer;
    private final ConcurrentLinkedQueue<Delivery> lane;
    private final AtomicBoolean laneScheduled;
    private final AtomicReference<StreamState> state;
    private final Executor enqueueExecutor;
    private final long pollIntervalMs;
    private int consumers;

    /**
     * Constructor.
     *
     * @param name stream name
     * @param capacity buffer capacity (0 = unbounded)
     * @param enqueueExecutor executor for lane tasks
     * @param pollIntervalMs interval at which receive re-checks for shutdown (milliseconds)
     */
    StreamChannel(String name, int capacity, Executor enqueueExecutor, long pollIntervalMs) {
        this.name = name;
        this.buffer = capacity == 0 ? new LinkedBlockingQueue<>() : new LinkedBlockingQueue<>(capacity);
        this.lane = new ConcurrentLinkedQueue<>();
        this.laneScheduled = new AtomicBoolean(false);
        this.state = new AtomicReference<>(StreamState.ACTIVE);
        this.enqueueExecutor = enqueueExecutor;
        this.pollIntervalMs = pollIntervalMs;
    }

    String name() {
        return name;
    }

    StreamState state() {
        return state.get();
    }

    /**
     * Messages waiting in the buffer and the lane.
     */
    int size() {
        return buffer.size() + lane.size();
    }

    synchronized int consumerCount() {
        return consumers;
    }

    /**
     * Adds a new message asynchronously.
     *
     * @param delivery delivery to add
     * @throws IllegalStateException if the stream is not ACTIVE
     */
    void enqueue(Delivery delivery) {
        if (state.get() != StreamState.ACTIVE) {
            throw new IllegalStateException("stream " + name + " is " + state.get());
        }
        lane.add(delivery);
        scheduleLane();
    }

    /**
     * Puts a failed message back on the stream.
     *
     * @param delivery delivery to requeue (attempt already incremented)
     * @return false if the stream is not ACTIVE; the caller dead-letters it
     */
    boolean requeue(Delivery delivery) {
        if (state.get() != StreamState.ACTIVE) {
            return false;
        }
        lane.add(delivery);
        scheduleLane();
        return true;
    }

    /**
     * Receives the next message, waiting if necessary.
     *
     * <p>Polls the buffer every pollIntervalMs. Returns null once the stream is closed
     * and both the lane and the buffer are empty.</p>
     *
     * @return next delivery, or null when the stream is finished
     * @throws InterruptedException if interrupted while waiting
     */
    Delivery receive() throws InterruptedException {
        while (true) {
            Delivery delivery = buffer.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
            if (delivery != null) {
                return delivery;
            }
            // lane을 먼저 확인: lane → buffer 이동은 put 후 poll
            if (state.get() != StreamState.ACTIVE && lane.isEmpty() && buffer.isEmpty()) {
                return null;
            }
        }
    }

    /**
     * Attaches a consumer.
     *
     * @throws IllegalStateException if the stream is not ACTIVE
     */
    synchronized void attachConsumer() {
        if (state.get() != StreamState.ACTIVE) {
            throw new IllegalStateException("stream " + name + " is " + state.get());
        }
        consumers++;
    }

    /**
     * Detaches a consumer. The last detach while DRAINING moves the stream to STOPPED.
     */
    synchronized void detachConsumer() {
        consumers--;
        if (consumers == 0 && state.get() == StreamState.DRAINING) {
            state.set(StreamState.STOPPED);
            log.info("Stream {} stopped", name);
        }
    }

    /**
     * Starts closing the stream. Idempotent.
     *
     * <p>DRAINING if consumers are attached, otherwise STOPPED at once with undelivered
     * messages discarded.</p>
     */
    synchronized void close() {
        if (state.get() != StreamState.ACTIVE) {
            return;
        }
        if (consumers > 0) {
            state.set(StreamState.DRAINING);
            log.info("Stream {} draining {} message(s) with {} consumer(s)", name, size(), consumers);
            return;
        }

        state.set(StreamState.STOPPED);
        int discarded = size();
        buffer.clear();
        lane.clear();
        if (discarded > 0) {
            log.warn("Stream {} stopped without consumers, {} undelivered message(s) discarded", name, discarded);
        } else {
            log.info("Stream {} stopped", name);
        }
    }

    private void scheduleLane() {
        if (!laneScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            enqueueExecutor.execute(this::drainLane);
        } catch (RejectedExecutionException e) {
            laneScheduled.set(false);
            throw new IllegalStateException("enqueue executor for stream " + name + " is shut down", e);
        }
    }

    private void drainLane() {
        try {
            while (true) {
                Delivery next = lane.peek();
                if (next == null) {
                    laneScheduled.set(false);
                    // flag 해제 직전에 추가된 항목이 있으면 이 task가 계속 처리
                    if (lane.isEmpty() || !laneScheduled.compareAndSet(false, true)) {
                        return;
                    }
                    continue;
                }

                if (state.get() == StreamState.STOPPED) {
                    lane.clear();
                    continue;
                }

                buffer.put(next);
                lane.poll();

                if (state.get() == StreamState.STOPPED) {
                    buffer.clear();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            laneScheduled.set(false);
            log.warn("Enqueue lane of stream {} interrupted, {} message(s) left pending", name, lane.size());
        }
    }
}
