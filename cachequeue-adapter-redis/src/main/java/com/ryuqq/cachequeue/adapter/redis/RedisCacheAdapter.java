package com.ryuqq.cachequeue.adapter.redis;

import com.ryuqq.cachequeue.core.exception.BackendException;
import com.ryuqq.cachequeue.core.exception.KeyNotFoundException;
import com.ryuqq.cachequeue.core.model.Lock;
import com.ryuqq.cachequeue.core.model.LockOptions;
import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.MessageHandler;
import com.ryuqq.cachequeue.core.model.ShutdownSignal;
import com.ryuqq.cachequeue.core.spi.CacheAdapter;
import com.ryuqq.cachequeue.core.value.CacheValue;
import glide.api.GlideClient;
import glide.api.models.commands.SetOptions;
import glide.api.models.configuration.GlideClientConfiguration;
import glide.api.models.configuration.NodeAddress;
import glide.api.models.configuration.ServerCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Networked {@link CacheAdapter} on a Valkey GLIDE {@link GlideClient}.
 *
 * <p>Every operation is a single round trip; this class only maps arguments and replies.</p>
 *
 * <p><strong>Command mapping:</strong></p>
 * <ul>
 *   <li>get / set / del → GET / SET [EX] / DEL</li>
 *   <li>hashGet / hashDel → HGET / HDEL (a real hash, unlike the in-process backend)</li>
 *   <li>increase / decrease → INCRBY ±1 guarded by EXISTS in one script, so a missing key
 *       fails instead of starting from zero</li>
 *   <li>expire → PEXPIRE</li>
 *   <li>append → XADD [MAXLEN ~ n]</li>
 *   <li>register / run → XGROUP CREATE + XREADGROUP loop ({@link RedisStreamConsumer})</li>
 *   <li>lock → SET NX PX ({@link RedisLocker})</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public final class RedisCacheAdapter implements CacheAdapter {

    private static final Logger log = LoggerFactory.getLogger(RedisCacheAdapter.class);

    static final String NAME = "redis";

    static final String CALCULATE_SCRIPT =
        "if redis.call('exists', KEYS[1]) == 0 then return false end "
            + "return redis.call('incrby', KEYS[1], ARGV[1])";

    private final RedisAdapterConfig config;
    private final ShutdownSignal signal;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Object connectLock = new Object();

    private volatile GlideClient client;
    private volatile RedisStreamConsumer consumer;
    private volatile RedisLocker locker;
    private volatile String prefix = "";

    public RedisCacheAdapter(RedisAdapterConfig config) {
        this(config, new ShutdownSignal());
    }

    /**
     * @param config connection and consumer settings
     * @param signal completion signal released by {@link #shutdown()}
     */
    public RedisCacheAdapter(RedisAdapterConfig config, ShutdownSignal signal) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (signal == null) {
            throw new IllegalArgumentException("signal cannot be null");
        }
        this.config = config;
        this.signal = signal;
        signal.onSignal(this::closeIfIdle);
    }

    /**
     * Binds an already created client. {@link #connect()} becomes a no-op.
     */
    RedisCacheAdapter(RedisAdapterConfig config, ShutdownSignal signal, GlideClient client) {
        this(config, signal);
        bind(client);
    }

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Creates the client and verifies it with PING. Idempotent.
     *
     * @throws BackendException if the server cannot be reached
     * @throws IllegalStateException if the adapter was shut down
     */
    @Override
    public void connect() {
        synchronized (connectLock) {
            if (signal.isSignaled()) {
                throw new IllegalStateException("redis adapter is shut down");
            }
            if (client != null) {
                return;
            }
            GlideClient created = GlideCalls.await(GlideClient.createClient(clientConfiguration()), "CONNECT", null);
            String pong = GlideCalls.await(created.ping(), "PING", null);
            bind(created);
            log.info("Redis adapter connected to {}:{} (db {}, reply {})",
                config.host(), config.port(), config.databaseId(), pong);
        }
    }

    @Override
    public void setPrefix(String prefix) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        this.prefix = prefix;
    }

    /**
     * @return the underlying GLIDE client
     * @throws IllegalStateException if not connected
     */
    public GlideClient nativeClient() {
        return client();
    }

    // ========== Key-value ==========

    @Override
    public String get(String key) {
        String k = prefixed(key);
        String value = GlideCalls.await(client().get(k), "GET", k);
        if (value == null) {
            throw new KeyNotFoundException(k);
        }
        return value;
    }

    @Override
    public void set(String key, CacheValue value, int ttlSeconds) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds cannot be negative, but was: " + ttlSeconds);
        }
        String k = prefixed(key);
        if (ttlSeconds == 0) {
            GlideCalls.await(client().set(k, value.encode()), "SET", k);
            return;
        }
        SetOptions options = SetOptions.builder()
            .expiry(SetOptions.Expiry.Seconds((long) ttlSeconds))
            .build();
        GlideCalls.await(client().set(k, value.encode(), options), "SET", k);
    }

    @Override
    public void del(String key) {
        String k = prefixed(key);
        GlideCalls.await(client().del(new String[] {k}), "DEL", k);
    }

    @Override
    public String hashGet(String hashName, String field) {
        requireField(field);
        String k = prefixed(hashName);
        String value = GlideCalls.await(client().hget(k, field), "HGET", k);
        if (value == null) {
            throw new KeyNotFoundException(k + field);
        }
        return value;
    }

    @Override
    public void hashDel(String hashName, String field) {
        requireField(field);
        String k = prefixed(hashName);
        GlideCalls.await(client().hdel(k, new String[] {field}), "HDEL", k);
    }

    @Override
    public long increase(String key) {
        return calculate(key, 1);
    }

    @Override
    public long decrease(String key) {
        return calculate(key, -1);
    }

    @Override
    public void expire(String key, Duration duration) {
        if (duration == null) {
            throw new IllegalArgumentException("duration cannot be null");
        }
        String k = prefixed(key);
        Boolean applied = GlideCalls.await(client().pexpire(k, duration.toMillis()), "PEXPIRE", k);
        if (!Boolean.TRUE.equals(applied)) {
            throw new KeyNotFoundException(k);
        }
    }

    // ========== Queue ==========

    /**
     * Adds the message with XADD and returns the id the server assigned.
     *
     * @throws IllegalArgumentException if the message has no values (XADD needs at least one field)
     */
    @Override
    public String append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (message.values().isEmpty()) {
            throw new IllegalArgumentException("message values cannot be empty");
        }
        Map<String, String> fields = new LinkedHashMap<>();
        message.values().forEach((field, value) -> fields.put(field, CacheValue.from(value).encode()));

        if (config.streamMaxLength() == 0) {
            return GlideCalls.await(client().xadd(message.stream(), fields), "XADD", message.stream());
        }

        List<String> command = new ArrayList<>();
        command.add("XADD");
        command.add(message.stream());
        command.add("MAXLEN");
        command.add("~");
        command.add(Long.toString(config.streamMaxLength()));
        command.add("*");
        fields.forEach((field, value) -> {
            command.add(field);
            command.add(value);
        });
        Object id = GlideCalls.await(client().customCommand(command.toArray(new String[0])), "XADD", message.stream());
        return String.valueOf(id);
    }

    @Override
    public void register(String streamName, MessageHandler handler) {
        if (streamName == null || streamName.isBlank()) {
            throw new IllegalArgumentException("streamName cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        client();
        consumer.register(streamName, handler);
    }

    /**
     * Runs the consumer loop until {@link #shutdown()}, then closes the client.
     */
    @Override
    public void run() {
        client();
        if (signal.isSignaled()) {
            closeClient();
            return;
        }
        running.set(true);
        try {
            log.info("Redis adapter running (streams {})", consumer.streamNames());
            consumer.run(signal);
        } finally {
            running.set(false);
            closeClient();
        }
    }

    /**
     * Fires the shutdown signal. Idempotent.
     */
    @Override
    public void shutdown() {
        if (signal.signal()) {
            log.info("Redis adapter shutdown requested");
        }
    }

    // ========== Lock ==========

    @Override
    public Lock lock(String key, long ttlSeconds, LockOptions options) {
        client();
        return locker.lock(prefixed(key), ttlSeconds, options);
    }

    Set<String> streamNames() {
        return consumer == null ? Set.of() : consumer.streamNames();
    }

    private long calculate(String key, long delta) {
        String k = prefixed(key);
        String[] command = {"EVAL", CALCULATE_SCRIPT, "1", k, Long.toString(delta)};
        Object reply = GlideCalls.await(client().customCommand(command), delta > 0 ? "INCR" : "DECR", k);
        if (reply == null) {
            throw new KeyNotFoundException(k);
        }
        return GlideCalls.asLong(reply, "INCRBY");
    }

    private void bind(GlideClient created) {
        if (created == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.consumer = new RedisStreamConsumer(created, config);
        this.locker = new RedisLocker(created);
        this.client = created;
    }

    private GlideClientConfiguration clientConfiguration() {
        ServerCredentials credentials = config.hasPassword()
            ? ServerCredentials.builder().password(config.password()).build()
            : null;
        return GlideClientConfiguration.builder()
            .address(NodeAddress.builder().host(config.host()).port(config.port()).build())
            .useTLS(config.useTls())
            .requestTimeout(config.requestTimeoutMs())
            .databaseId(config.databaseId())
            .clientName(config.consumerName())
            .credentials(credentials)
            .build();
    }

    private void closeIfIdle() {
        if (!running.get()) {
            closeClient();
        }
    }

    private void closeClient() {
        GlideClient current = client;
        if (current == null || !closed.compareAndSet(false, true)) {
            return;
        }
        try {
            current.close();
            log.info("Redis adapter disconnected from {}:{}", config.host(), config.port());
        } catch (ExecutionException e) {
            log.warn("Closing redis client failed", e.getCause() != null ? e.getCause() : e);
        }
    }

    private GlideClient client() {
        GlideClient current = client;
        if (current == null) {
            throw new IllegalStateException("redis adapter is not connected");
        }
        return current;
    }

    private String prefixed(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return prefix + key;
    }

    private static void requireField(String field) {
        if (field == null) {
            throw new IllegalArgumentException("field cannot be null");
        }
    }
}
