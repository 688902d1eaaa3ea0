/**
 * In-memory stream queue: registry, per-stream channel and consumer dispatchers.
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li><strong>Registry:</strong> {@link java.util.concurrent.ConcurrentHashMap} of stream name → channel,
 *       created on first use</li>
 *   <li><strong>Channel:</strong> {@link java.util.concurrent.LinkedBlockingQueue} buffer fed by a
 *       single-flight enqueue lane</li>
 *   <li><strong>Dispatcher:</strong> one thread per registration pulling from the channel</li>
 *   <li><strong>Dead Letter Queue:</strong> {@link java.util.concurrent.CopyOnWriteArrayList} of
 *       messages that were not requeued</li>
 * </ul>
 *
 * <h2>Message Lifecycle</h2>
 *
 * <pre>
 * ┌─────────────┐
 * │   append    │ (new UUID id, caller returns immediately)
 * └──────┬──────┘
 *        ▼
 * ┌─────────────┐
 * │    lane     │ (FIFO, background put into buffer)
 * └──────┬──────┘
 *        ▼
 * ┌─────────────┐
 * │   buffer    │ (bounded or unbounded)
 * └──────┬──────┘
 *        ▼
 * ┌─────────────┐
 * │  handler    │
 * └──────┬──────┘
 *        ├──► returns ───────────────────────────────► [Discarded]
 *        ├──► throws ────────────────────────────────► [Back to lane, same id]
 *        └──► throws, attempts exhausted / draining ─► [Dead Letter Queue]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>In-Memory Only:</strong> Messages lost on process restart</li>
 *   <li><strong>Single JVM:</strong> No cross-process consumers</li>
 *   <li><strong>No backoff:</strong> Failed messages are requeued immediately</li>
 * </ul>
 *
 * @see com.ryuqq.cachequeue.core.spi.MessageQueue
 * @author Cachequeue Team
 * @since 1.0.0
 */
package com.ryuqq.cachequeue.adapter.inmemory.queue;
