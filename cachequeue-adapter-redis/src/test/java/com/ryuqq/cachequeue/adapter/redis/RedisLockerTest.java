package com.ryuqq.cachequeue.adapter.redis;

import com.ryuqq.cachequeue.core.exception.LockContentionException;
import com.ryuqq.cachequeue.core.exception.LockNotHeldException;
import com.ryuqq.cachequeue.core.model.Lock;
import com.ryuqq.cachequeue.core.model.LockOptions;
import com.ryuqq.cachequeue.core.model.RetryStrategy;
import glide.api.GlideClient;
import glide.api.models.commands.SetOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * RedisLocker / RedisLock 단위 테스트.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RedisLockerTest {

    @Mock
    private GlideClient client;

    private RedisLocker locker;

    @BeforeEach
    void setUp() {
        locker = new RedisLocker(client);
    }

    @Test
    void SET_NX_성공_시_token과_metadata를_가진_lock_반환() {
        // given
        ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
        when(client.set(eq("job"), stored.capture(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture("OK"));

        // when
        Lock lock = locker.lock("job", 10, LockOptions.defaults().withMetadata("worker-1"));

        // then
        assertThat(lock.key()).isEqualTo("job");
        assertThat(lock.metadata()).isEqualTo("worker-1");
        assertThat(stored.getValue()).isEqualTo(lock.token() + "worker-1");
    }

    @Test
    void 재시도_없이_점유된_lock은_LockContentionException() {
        // given
        when(client.set(eq("job"), anyString(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture(null));

        // when & then
        assertThatThrownBy(() -> locker.lock("job", 10, null))
            .isInstanceOf(LockContentionException.class)
            .hasMessage("lock not obtained: job");
        verify(client, times(1)).set(eq("job"), anyString(), any(SetOptions.class));
    }

    @Test
    void 재시도_전략에_따라_다시_시도함() {
        // given
        when(client.set(eq("job"), anyString(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture(null))
            .thenReturn(CompletableFuture.completedFuture(null))
            .thenReturn(CompletableFuture.completedFuture("OK"));
        LockOptions options = LockOptions.defaults()
            .withRetryStrategy(RetryStrategy.limitRetry(RetryStrategy.linearBackoff(Duration.ofMillis(1)), 5));

        // when
        Lock lock = locker.lock("job", 10, options);

        // then
        assertThat(lock).isNotNull();
        verify(client, times(3)).set(eq("job"), anyString(), any(SetOptions.class));
    }

    @Test
    void 재시도_횟수_소진_시_LockContentionException() {
        // given
        when(client.set(eq("job"), anyString(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture(null));
        LockOptions options = LockOptions.defaults()
            .withRetryStrategy(RetryStrategy.limitRetry(RetryStrategy.linearBackoff(Duration.ofMillis(1)), 2));

        // when & then
        assertThatThrownBy(() -> locker.lock("job", 10, options)).isInstanceOf(LockContentionException.class);
        verify(client, times(2)).set(eq("job"), anyString(), any(SetOptions.class));
    }

    @Test
    void release는_저장값_비교_script로_삭제() {
        // given
        when(client.set(eq("job"), anyString(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture("OK"));
        Lock lock = locker.lock("job", 10, null);
        ArgumentCaptor<String[]> command = ArgumentCaptor.forClass(String[].class);
        when(client.customCommand(command.capture())).thenReturn(CompletableFuture.<Object>completedFuture(1L));

        // when
        lock.release();

        // then
        assertThat(command.getValue())
            .containsExactly("EVAL", RedisLock.RELEASE_SCRIPT, "1", "job", lock.token());
    }

    @Test
    void 이미_잃은_lock_release는_LockNotHeldException() {
        // given
        when(client.set(eq("job"), anyString(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture("OK"));
        Lock lock = locker.lock("job", 10, null);
        when(client.customCommand(any(String[].class))).thenReturn(CompletableFuture.<Object>completedFuture(0L));

        // when & then
        assertThatThrownBy(lock::release)
            .isInstanceOf(LockNotHeldException.class)
            .hasMessage("lock not held: job");
        assertThatThrownBy(() -> lock.refresh(Duration.ofSeconds(5))).isInstanceOf(LockNotHeldException.class);
    }

    @Test
    void refresh는_밀리초_TTL을_전달하고_ttl은_남은_시간을_반환() {
        // given
        when(client.set(eq("job"), anyString(), any(SetOptions.class)))
            .thenReturn(CompletableFuture.completedFuture("OK"));
        Lock lock = locker.lock("job", 10, null);
        ArgumentCaptor<String[]> command = ArgumentCaptor.forClass(String[].class);
        when(client.customCommand(command.capture()))
            .thenReturn(CompletableFuture.<Object>completedFuture(1L))
            .thenReturn(CompletableFuture.<Object>completedFuture(4500L))
            .thenReturn(CompletableFuture.<Object>completedFuture(-3L));

        // when
        lock.refresh(Duration.ofSeconds(5));
        Duration remaining = lock.ttl();
        Duration lost = lock.ttl();

        // then
        assertThat(command.getAllValues().get(0)).endsWith("5000");
        assertThat(remaining).isEqualTo(Duration.ofMillis(4500));
        assertThat(lost).isEqualTo(Duration.ZERO);
    }

    @Test
    void 잘못된_TTL은_거부됨() {
        assertThatThrownBy(() -> locker.lock("job", 0, null)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(client);
    }
}
