package com.ryuqq.cachequeue.adapter.redis;

import com.ryuqq.cachequeue.core.exception.BackendException;
import com.ryuqq.cachequeue.core.exception.CacheException;
import com.ryuqq.cachequeue.core.exception.ValueTypeException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * GLIDE 비동기 호출을 동기 호출로 변환하고 오류를 {@link CacheException} 계층으로 매핑.
 *
 * <p><strong>매핑 규칙:</strong></p>
 * <ul>
 *   <li>"not an integer" / "overflow" 오류 → {@link ValueTypeException}</li>
 *   <li>인터럽트 → {@link BackendException} (interrupt flag 유지)</li>
 *   <li>그 외 모든 실패 → {@link BackendException}</li>
 * </ul>
 *
 * <p>nil 응답 해석 (KeyNotFound)은 호출자 책임입니다.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
final class GlideCalls {

    private GlideCalls() {
    }

    /**
     * 완료까지 대기.
     *
     * @param future GLIDE 호출 결과
     * @param command 오류 메시지용 명령 이름
     * @param key 오류 메시지용 key (없으면 null)
     * @return 응답 값 (nil이면 null)
     */
    static <T> T await(CompletableFuture<T> future, String command, String key) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException(command + " interrupted", e);
        } catch (ExecutionException e) {
            throw translate(command, key, e.getCause() != null ? e.getCause() : e);
        }
    }

    static CacheException translate(String command, String key, Throwable failure) {
        if (failure instanceof CacheException cacheException) {
            return cacheException;
        }
        String message = failure.getMessage() == null ? failure.toString() : failure.getMessage();
        if (message.contains("not an integer") || message.contains("overflow")) {
            return new ValueTypeException(key, "value of " + key + " is not an integer: " + message, failure);
        }
        String target = key == null ? "" : " " + key;
        return new BackendException(command + target + " failed: " + message, failure);
    }

    static long asLong(Object reply, String command) {
        if (reply instanceof Number number) {
            return number.longValue();
        }
        throw new BackendException(command + " returned unexpected reply: " + reply);
    }
}
