package com.ryuqq.cachequeue.adapter.redis;

import java.util.UUID;

/**
 * RedisCacheAdapter 설정 (불변 record).
 *
 * <p><strong>연결 설정:</strong></p>
 * <ul>
 *   <li>host / port: 서버 주소 (기본 localhost:6379)</li>
 *   <li>databaseId: 논리 DB 번호 (기본 0)</li>
 *   <li>password: 인증 비밀번호 (빈 문자열 = 인증 없음)</li>
 *   <li>useTls: TLS 사용 여부 (기본 false)</li>
 *   <li>requestTimeoutMs: 요청 타임아웃 (기본 5000ms, blockTimeoutMs보다 커야 함)</li>
 * </ul>
 *
 * <p><strong>Stream consumer 설정:</strong></p>
 * <ul>
 *   <li>consumerGroup: consumer group 이름 (기본 "cachequeue")</li>
 *   <li>consumerName: group 내 consumer 이름 (기본 호스트별 고유 이름)</li>
 *   <li>blockTimeoutMs: XREADGROUP BLOCK 시간 (기본 2000ms)</li>
 *   <li>readCount: XREADGROUP COUNT (기본 10)</li>
 *   <li>concurrency: handler 실행 스레드 수 (기본 4)</li>
 *   <li>streamMaxLength: XADD 시 근사 trim 길이 (기본 0 = trim 안 함)</li>
 * </ul>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
public record RedisAdapterConfig(
    String host,
    int port,
    int databaseId,
    String password,
    boolean useTls,
    int requestTimeoutMs,
    String consumerGroup,
    String consumerName,
    long blockTimeoutMs,
    int readCount,
    int concurrency,
    long streamMaxLength
) {

    /**
     * 기본 설정 생성자 (localhost:6379).
     */
    public RedisAdapterConfig() {
        this("localhost", 6379, 0, "", false, 5000,
            "cachequeue", defaultConsumerName(), 2000, 10, 4, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RedisAdapterConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be null or blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 (current: " + port + ")");
        }
        if (databaseId < 0) {
            throw new IllegalArgumentException("databaseId cannot be negative (current: " + databaseId + ")");
        }
        if (password == null) {
            throw new IllegalArgumentException("password cannot be null");
        }
        if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "requestTimeoutMs must be positive (current: " + requestTimeoutMs + ")"
            );
        }
        if (consumerGroup == null || consumerGroup.isBlank()) {
            throw new IllegalArgumentException("consumerGroup cannot be null or blank");
        }
        if (consumerName == null || consumerName.isBlank()) {
            throw new IllegalArgumentException("consumerName cannot be null or blank");
        }
        if (blockTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "blockTimeoutMs must be positive (current: " + blockTimeoutMs + ")"
            );
        }
        if (blockTimeoutMs >= requestTimeoutMs) {
            throw new IllegalArgumentException(
                "blockTimeoutMs must be less than requestTimeoutMs (block: " + blockTimeoutMs
                    + ", request: " + requestTimeoutMs + ")"
            );
        }
        if (readCount <= 0) {
            throw new IllegalArgumentException("readCount must be positive (current: " + readCount + ")");
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be positive (current: " + concurrency + ")");
        }
        if (streamMaxLength < 0) {
            throw new IllegalArgumentException(
                "streamMaxLength cannot be negative (current: " + streamMaxLength + ")"
            );
        }
    }

    public boolean hasPassword() {
        return !password.isEmpty();
    }

    public RedisAdapterConfig withAddress(String host, int port) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withDatabaseId(int databaseId) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withPassword(String password) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withUseTls(boolean useTls) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withRequestTimeoutMs(int requestTimeoutMs) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withConsumer(String consumerGroup, String consumerName) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withBlockTimeoutMs(long blockTimeoutMs) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withReadCount(int readCount) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withConcurrency(int concurrency) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    public RedisAdapterConfig withStreamMaxLength(long streamMaxLength) {
        return new RedisAdapterConfig(host, port, databaseId, password, useTls, requestTimeoutMs,
            consumerGroup, consumerName, blockTimeoutMs, readCount, concurrency, streamMaxLength);
    }

    @Override
    public String toString() {
        return "RedisAdapterConfig{host=" + host + ", port=" + port + ", databaseId=" + databaseId
            + ", password=" + (hasPassword() ? "****" : "") + ", useTls=" + useTls
            + ", consumerGroup=" + consumerGroup + ", consumerName=" + consumerName + "}";
    }

    private static String defaultConsumerName() {
        return "cachequeue-" + ProcessHandle.current().pid() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
