package com.ryuqq.cachequeue.adapter.redis;

import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.MessageHandler;
import com.ryuqq.cachequeue.core.model.ShutdownSignal;
import glide.api.GlideClient;
import glide.api.models.commands.stream.StreamReadGroupOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumer group 기반 stream 소비 루프.
 *
 * <p><strong>처리 흐름 (cycle 단위):</strong></p>
 * <pre>
 * XREADGROUP (stream별 id: 보류 재처리 중이면 "0", 아니면 "&gt;")
 *   ↓
 * 각 entry → handler 실행 (고정 크기 pool, concurrency)
 *   ├─ 정상 반환 → XACK
 *   └─ 예외 발생 → ACK 하지 않음, 해당 stream을 보류 재처리 대상으로 표시
 *   ↓
 * batch 전체 완료 대기 → 다음 cycle
 * </pre>
 *
 * <p><strong>At-least-once:</strong> 실패한 entry는 pending 목록에 남고, 다음 cycle에서
 * id "0"으로 다시 읽혀 재처리됩니다. 보류 재처리 중 빈 응답을 받으면 다시 "&gt;"로 돌아갑니다.</p>
 *
 * <p>같은 stream에 handler를 여러 개 등록하면 entry가 round-robin으로 분배됩니다.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
final class RedisStreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(RedisStreamConsumer.class);

    static final String NEW_ENTRIES = ">";
    static final String PENDING_ENTRIES = "0";

    private final GlideClient client;
    private final RedisAdapterConfig config;
    private final Map<String, HandlerGroup> handlers;
    private final Set<String> pendingStreams;

    RedisStreamConsumer(GlideClient client, RedisAdapterConfig config) {
        this.client = client;
        this.config = config;
        this.handlers = new ConcurrentHashMap<>();
        this.pendingStreams = ConcurrentHashMap.newKeySet();
    }

    /**
     * Consumer group 생성 후 handler 등록.
     *
     * <p>이전 실행에서 남은 pending entry가 있을 수 있으므로 첫 cycle은 보류 재처리부터 시작합니다.</p>
     */
    void register(String streamName, MessageHandler handler) {
        createGroup(streamName);
        handlers.computeIfAbsent(streamName, name -> new HandlerGroup()).add(handler);
        pendingStreams.add(streamName);
        log.info("Consumer {} registered on stream {} (group {})",
            config.consumerName(), streamName, config.consumerGroup());
    }

    Set<String> streamNames() {
        return Set.copyOf(handlers.keySet());
    }

    /**
     * signal이 발생할 때까지 소비 루프 실행.
     */
    void run(ShutdownSignal signal) {
        if (handlers.isEmpty()) {
            log.warn("No stream registered; waiting for shutdown only");
        }
        ExecutorService workers = Executors.newFixedThreadPool(config.concurrency(), workerThreads());
        try {
            while (!signal.isSignaled() && !Thread.currentThread().isInterrupted()) {
                if (handlers.isEmpty()) {
                    awaitQuietly(signal);
                    continue;
                }
                try {
                    pollOnce(workers);
                } catch (RuntimeException e) {
                    if (signal.isSignaled()) {
                        break;
                    }
                    log.error("Stream read cycle failed", e);
                    awaitQuietly(signal);
                }
            }
        } finally {
            workers.shutdown();
            awaitWorkers(workers);
            log.info("Consumer {} stopped", config.consumerName());
        }
    }

    /**
     * 한 cycle 실행: 읽기 → 처리 → ACK.
     *
     * @return 처리한 entry 수
     */
    int pollOnce(ExecutorService workers) {
        Map<String, String> keysAndIds = new LinkedHashMap<>();
        for (String stream : handlers.keySet()) {
            keysAndIds.put(stream, pendingStreams.contains(stream) ? PENDING_ENTRIES : NEW_ENTRIES);
        }

        StreamReadGroupOptions options = StreamReadGroupOptions.builder()
            .count((long) config.readCount())
            .block(config.blockTimeoutMs())
            .build();
        Map<String, Map<String, String[][]>> reply = GlideCalls.await(
            client.xreadgroup(keysAndIds, config.consumerGroup(), config.consumerName(), options),
            "XREADGROUP", null);

        // 보류 재처리 중 응답이 비어 있으면 새 entry 읽기로 전환
        for (Map.Entry<String, String> requested : keysAndIds.entrySet()) {
            if (PENDING_ENTRIES.equals(requested.getValue()) && isEmpty(reply, requested.getKey())) {
                pendingStreams.remove(requested.getKey());
            }
        }
        if (reply == null || reply.isEmpty()) {
            return 0;
        }

        List<Future<?>> inFlight = new ArrayList<>();
        for (Map.Entry<String, Map<String, String[][]>> streamEntries : reply.entrySet()) {
            String stream = streamEntries.getKey();
            HandlerGroup group = handlers.get(stream);
            if (group == null || streamEntries.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, String[][]> entry : streamEntries.getValue().entrySet()) {
                inFlight.add(workers.submit(() -> process(stream, entry.getKey(), entry.getValue(), group.next())));
            }
        }
        awaitAll(inFlight);
        return inFlight.size();
    }

    private void process(String stream, String id, String[][] fields, MessageHandler handler) {
        if (fields == null) {
            // pending 목록에 남아 있지만 stream에서 삭제된 entry
            ack(stream, id);
            return;
        }
        Message message = new Message(id, stream, toValues(fields));
        try {
            handler.handle(message);
        } catch (Exception e) {
            pendingStreams.add(stream);
            log.warn("Handler failed for {} on stream {}; left pending for redelivery", id, stream, e);
            return;
        }
        ack(stream, id);
    }

    private void ack(String stream, String id) {
        GlideCalls.await(client.xack(stream, config.consumerGroup(), new String[] {id}), "XACK", stream);
    }

    private void createGroup(String streamName) {
        String[] command = {"XGROUP", "CREATE", streamName, config.consumerGroup(), "$", "MKSTREAM"};
        try {
            GlideCalls.await(client.customCommand(command), "XGROUP CREATE", streamName);
        } catch (RuntimeException e) {
            if (!String.valueOf(e.getMessage()).contains("BUSYGROUP")) {
                throw e;
            }
            log.debug("Consumer group {} already exists on stream {}", config.consumerGroup(), streamName);
        }
    }

    private void awaitAll(List<Future<?>> inFlight) {
        for (Future<?> future : inFlight) {
            try {
                future.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ExecutionException e) {
                log.error("Entry processing failed", e.getCause());
            }
        }
    }

    private void awaitQuietly(ShutdownSignal signal) {
        try {
            signal.await(Duration.ofMillis(config.blockTimeoutMs()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void awaitWorkers(ExecutorService workers) {
        try {
            if (!workers.awaitTermination(config.requestTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Stream workers did not finish within {}ms", config.requestTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static boolean isEmpty(Map<String, Map<String, String[][]>> reply, String stream) {
        if (reply == null) {
            return true;
        }
        Map<String, String[][]> entries = reply.get(stream);
        return entries == null || entries.isEmpty();
    }

    private static Map<String, Object> toValues(String[][] fields) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (String[] pair : fields) {
            if (pair != null && pair.length == 2) {
                values.put(pair[0], pair[1]);
            }
        }
        return values;
    }

    private ThreadFactory workerThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "cachequeue-redis-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * 같은 stream에 등록된 handler 목록 (round-robin).
     */
    private static final class HandlerGroup {

        private final List<MessageHandler> members = new CopyOnWriteArrayList<>();
        private final AtomicInteger cursor = new AtomicInteger();

        void add(MessageHandler handler) {
            members.add(handler);
        }

        MessageHandler next() {
            return members.get(Math.floorMod(cursor.getAndIncrement(), members.size()));
        }
    }
}
