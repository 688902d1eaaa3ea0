package com.ryuqq.cachequeue.adapter.redis;

import com.ryuqq.cachequeue.core.exception.BackendException;
import com.ryuqq.cachequeue.core.exception.LockContentionException;
import com.ryuqq.cachequeue.core.model.Lock;
import com.ryuqq.cachequeue.core.model.LockOptions;
import com.ryuqq.cachequeue.core.model.RetryStrategy;
import com.ryuqq.cachequeue.core.spi.Locker;
import glide.api.GlideClient;
import glide.api.models.commands.SetOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * {@code SET key token NX PX ttl} 기반 분산 lock.
 *
 * <p><strong>획득 절차:</strong></p>
 * <ol>
 *   <li>랜덤 token 생성</li>
 *   <li>SET NX PX 시도 → 성공 시 {@link RedisLock} 반환</li>
 *   <li>실패 시 {@link RetryStrategy#nextBackoffMs(int)} 만큼 대기 후 재시도</li>
 *   <li>{@link RetryStrategy#STOP} → {@link LockContentionException}</li>
 * </ol>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
final class RedisLocker implements Locker {

    private static final Logger log = LoggerFactory.getLogger(RedisLocker.class);

    private final GlideClient client;

    RedisLocker(GlideClient client) {
        this.client = client;
    }

    @Override
    public Lock lock(String key, long ttlSeconds, LockOptions options) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive (current: " + ttlSeconds + ")");
        }
        LockOptions effective = options == null ? LockOptions.defaults() : options;

        String token = UUID.randomUUID().toString();
        String value = token + effective.metadata();
        SetOptions setOptions = SetOptions.builder()
            .conditionalSet(SetOptions.ConditionalSet.ONLY_IF_DOES_NOT_EXIST)
            .expiry(SetOptions.Expiry.Milliseconds(ttlSeconds * 1000L))
            .build();

        int attempt = 0;
        while (true) {
            String reply = GlideCalls.await(client.set(key, value, setOptions), "SET", key);
            if (reply != null) {
                log.debug("Lock {} obtained after {} retries", key, attempt);
                return new RedisLock(client, key, token, effective.metadata());
            }

            attempt++;
            long backoffMs = effective.retryStrategy().nextBackoffMs(attempt);
            if (backoffMs < 0) {
                throw new LockContentionException(key);
            }
            sleep(key, backoffMs);
        }
    }

    private static void sleep(String key, long backoffMs) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("lock " + key + " interrupted while waiting to retry", e);
        }
    }
}
