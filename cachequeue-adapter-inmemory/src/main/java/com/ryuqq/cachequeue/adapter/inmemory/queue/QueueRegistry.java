package com.ryuqq.cachequeue.adapter.inmemory.queue;

import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.MessageHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of stream name → channel.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Creates a stream channel on first append/register (computeIfAbsent)</li>
 *   <li>append: adds a copy with a new UUID id to the channel lane</li>
 *   <li>register: attaches a consumer and starts its dispatcher thread</li>
 *   <li>close: starts closing every stream</li>
 *   <li>Holds dead letters</li>
 * </ul>
 *
 * <p><strong>Threads:</strong></p>
 * <ul>
 *   <li>enqueue executor: lane tasks (at most one per stream at a time)</li>
 *   <li>dispatcher executor: one long-running thread per register call</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public final class QueueRegistry {

    private static final Logger log = LoggerFactory.getLogger(QueueRegistry.class);

    private final ConcurrentHashMap<String, StreamChannel> streams;
    private final List<DeadLetter> deadLetters;
    private final ExecutorService enqueueExecutor;
    private final ExecutorService dispatcherExecutor;
    private final AtomicBoolean closed;
    private final int streamCapacity;
    private final int maxDeliveryAttempts;
    private final long receivePollIntervalMs;

    /**
     * Constructor.
     *
     * @param streamCapacity stream buffer capacity (0 = unbounded)
     * @param maxDeliveryAttempts maximum deliveries per message (0 = unlimited)
     * @param receivePollIntervalMs interval at which dispatchers check for shutdown (milliseconds)
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public QueueRegistry(int streamCapacity, int maxDeliveryAttempts, long receivePollIntervalMs) {
        if (streamCapacity < 0) {
            throw new IllegalArgumentException("streamCapacity cannot be negative, but was: " + streamCapacity);
        }
        if (maxDeliveryAttempts < 0) {
            throw new IllegalArgumentException("maxDeliveryAttempts cannot be negative, but was: " + maxDeliveryAttempts);
        }
        if (receivePollIntervalMs <= 0) {
            throw new IllegalArgumentException("receivePollIntervalMs must be positive, but was: " + receivePollIntervalMs);
        }

        this.streams = new ConcurrentHashMap<>();
        this.deadLetters = new CopyOnWriteArrayList<>();
        this.enqueueExecutor = Executors.newCachedThreadPool(daemonThreads("cachequeue-enqueue-"));
        this.dispatcherExecutor = Executors.newCachedThreadPool(daemonThreads("cachequeue-dispatcher-"));
        this.closed = new AtomicBoolean(false);
        this.streamCapacity = streamCapacity;
        this.maxDeliveryAttempts = maxDeliveryAttempts;
        this.receivePollIntervalMs = receivePollIntervalMs;
    }

    /**
     * Appends a message.
     *
     * <p>The caller never waits. Returns the assigned id; delivery is not confirmed.</p>
     *
     * @param message message to append (its id is replaced)
     * @return assigned id
     * @throws IllegalArgumentException if message is null
     * @throws IllegalStateException if the registry or the stream is closed
     */
    public String append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }

        StreamChannel channel = channelFor(message.stream());
        String id = UUID.randomUUID().toString();
        channel.enqueue(new Delivery(message.withId(id), 1));
        return id;
    }

    /**
     * Registers a handler and starts its dispatcher.
     *
     * <p>Registering the same stream again adds a competing consumer (not a broadcast).</p>
     *
     * @param streamName stream name
     * @param handler message handler
     * @throws IllegalArgumentException if a parameter is invalid
     * @throws IllegalStateException if the registry or the stream is closed
     */
    public void register(String streamName, MessageHandler handler) {
        if (streamName == null || streamName.isBlank()) {
            throw new IllegalArgumentException("streamName cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        StreamChannel channel = channelFor(streamName);
        channel.attachConsumer();
        try {
            dispatcherExecutor.execute(new ConsumerDispatcher(channel, handler, maxDeliveryAttempts, deadLetters::add));
        } catch (RejectedExecutionException e) {
            channel.detachConsumer();
            throw new IllegalStateException("queue registry is shut down", e);
        }
        log.info("Consumer registered on stream {} ({} total)", streamName, channel.consumerCount());
    }

    /**
     * Starts closing every stream. Idempotent.
     *
     * <p>Does not wait. Use {@link #awaitTermination(Duration)} to wait for completion.</p>
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing {} stream(s)", streams.size());
        streams.values().forEach(StreamChannel::close);
    }

    /**
     * Waits for every dispatcher and lane task to finish.
     *
     * @param timeout maximum time to wait
     * @return true if everything finished within the timeout
     * @throws IllegalStateException if close() has not been called
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!closed.get()) {
            throw new IllegalStateException("queue registry is not closed");
        }
        long deadlineNanos = System.nanoTime() + timeout.toNanos();

        dispatcherExecutor.shutdown();
        boolean dispatchersDone = dispatcherExecutor.awaitTermination(timeout.toNanos(), TimeUnit.NANOSECONDS);

        enqueueExecutor.shutdown();
        long remaining = Math.max(0, deadlineNanos - System.nanoTime());
        boolean enqueueDone = enqueueExecutor.awaitTermination(remaining, TimeUnit.NANOSECONDS);

        return dispatchersDone && enqueueDone;
    }

    /**
     * @param streamName stream name
     * @return state, UNCREATED if the stream does not exist
     */
    public StreamState state(String streamName) {
        StreamChannel channel = streams.get(streamName);
        return channel == null ? StreamState.UNCREATED : channel.state();
    }

    /**
     * Returns the number of waiting messages. Used for test assertions.
     *
     * @param streamName stream name
     * @return waiting message count (0 if the stream does not exist)
     */
    public int pendingCount(String streamName) {
        StreamChannel channel = streams.get(streamName);
        return channel == null ? 0 : channel.size();
    }

    /**
     * @return names of created streams (sorted)
     */
    public Set<String> streamNames() {
        return new TreeSet<>(streams.keySet());
    }

    /**
     * @return snapshot of dead letters
     */
    public List<DeadLetter> deadLetters() {
        return new ArrayList<>(deadLetters);
    }

    public boolean isClosed() {
        return closed.get();
    }

    private StreamChannel channelFor(String streamName) {
        if (closed.get()) {
            throw new IllegalStateException("queue registry is closed");
        }
        StreamChannel channel = streams.computeIfAbsent(streamName, name -> {
            log.info("Stream {} created", name);
            return new StreamChannel(name, streamCapacity, enqueueExecutor, receivePollIntervalMs);
        });
        // close()와 경합한 경우 새 channel도 닫힘 상태로 맞춤
        if (closed.get()) {
            channel.close();
            throw new IllegalStateException("queue registry is closed");
        }
        return channel;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
