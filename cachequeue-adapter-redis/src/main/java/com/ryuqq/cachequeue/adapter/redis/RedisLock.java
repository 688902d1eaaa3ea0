package com.ryuqq.cachequeue.adapter.redis;

import com.ryuqq.cachequeue.core.exception.LockNotHeldException;
import com.ryuqq.cachequeue.core.model.Lock;
import glide.api.GlideClient;

import java.time.Duration;

/**
 * 획득한 분산 lock handle.
 *
 * <p>저장 값은 {@code token + metadata}이며, 모든 조작은 저장 값 비교 후 수행되는 Lua script로
 * 원자적으로 실행됩니다. 다른 소유자가 같은 key를 다시 획득한 경우 release/refresh는
 * {@link LockNotHeldException}으로 실패합니다.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
final class RedisLock implements Lock {

    static final String RELEASE_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end";

    static final String REFRESH_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pexpire', KEYS[1], ARGV[2]) else return 0 end";

    static final String PTTL_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('pttl', KEYS[1]) else return -3 end";

    private final GlideClient client;
    private final String key;
    private final String token;
    private final String metadata;

    RedisLock(GlideClient client, String key, String token, String metadata) {
        this.client = client;
        this.key = key;
        this.token = token;
        this.metadata = metadata;
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public String token() {
        return token;
    }

    @Override
    public String metadata() {
        return metadata;
    }

    /**
     * 남은 유효 시간.
     *
     * @return 남은 시간, lock을 잃었으면 {@link Duration#ZERO}
     */
    @Override
    public Duration ttl() {
        long pttl = eval(PTTL_SCRIPT, value());
        return pttl > 0 ? Duration.ofMillis(pttl) : Duration.ZERO;
    }

    @Override
    public void refresh(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        if (eval(REFRESH_SCRIPT, value(), Long.toString(ttl.toMillis())) == 0) {
            throw new LockNotHeldException(key);
        }
    }

    @Override
    public void release() {
        if (eval(RELEASE_SCRIPT, value()) == 0) {
            throw new LockNotHeldException(key);
        }
    }

    String value() {
        return token + metadata;
    }

    private long eval(String script, String... args) {
        String[] command = new String[4 + args.length];
        command[0] = "EVAL";
        command[1] = script;
        command[2] = "1";
        command[3] = key;
        System.arraycopy(args, 0, command, 4, args.length);
        return GlideCalls.asLong(GlideCalls.await(client.customCommand(command), "EVAL", key), "EVAL");
    }
}
