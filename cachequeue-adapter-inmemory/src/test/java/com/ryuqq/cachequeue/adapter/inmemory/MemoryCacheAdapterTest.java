package com.ryuqq.cachequeue.adapter.inmemory;

import com.ryuqq.cachequeue.adapter.inmemory.queue.DeadLetter;
import com.ryuqq.cachequeue.adapter.inmemory.queue.StreamState;
import com.ryuqq.cachequeue.core.model.Message;
import com.ryuqq.cachequeue.core.model.ShutdownSignal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MemoryCacheAdapter 생명주기 및 부가 기능 테스트.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
class MemoryCacheAdapterTest {

    private MemoryCacheAdapter adapter;

    @AfterEach
    void tearDown() {
        if (adapter != null) {
            adapter.shutdown();
        }
    }

    @Test
    void connect_전_호출_시_IllegalStateException() {
        // given
        adapter = new MemoryCacheAdapter();

        // when & then
        assertThatThrownBy(() -> adapter.get("k"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("memory adapter is not connected");
        assertThatThrownBy(() -> adapter.append(Message.of("s", Map.of())))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void connect는_멱등하며_데이터를_유지함() {
        // given
        adapter = new MemoryCacheAdapter();
        adapter.connect();
        adapter.set("k", "v", 0);

        // when
        adapter.connect();

        // then
        assertThat(adapter.get("k")).isEqualTo("v");
        assertThat(adapter.name()).isEqualTo("memory");
    }

    @Test
    void shutdown_후_connect_시_IllegalStateException() {
        // given
        adapter = new MemoryCacheAdapter();
        adapter.connect();
        adapter.shutdown();

        // when & then
        assertThatThrownBy(adapter::connect)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("shut down");
    }

    @Test
    void 공유_signal이_발생하면_stream이_종료됨() throws Exception {
        // given
        ShutdownSignal signal = new ShutdownSignal();
        adapter = new MemoryCacheAdapter(new MemoryAdapterConfig(), signal);
        adapter.connect();
        adapter.register("s", message -> { });

        // when: adapter가 아닌 외부에서 signal 발생
        signal.signal();

        // then
        assertThat(adapter.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(adapter.streamState("s")).isEqualTo(StreamState.STOPPED);
    }

    @Test
    void 재전달_상한_초과_메시지는_deadLetters로_조회됨() throws Exception {
        // given
        adapter = new MemoryCacheAdapter(new MemoryAdapterConfig().withMaxDeliveryAttempts(2), new ShutdownSignal());
        adapter.connect();
        adapter.register("s", message -> {
            throw new IllegalArgumentException("bad payload");
        });

        // when
        String id = adapter.append(Message.of("s", Map.of("k", "v")));

        // then
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (adapter.deadLetters().isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        List<DeadLetter> deadLetters = adapter.deadLetters();
        assertThat(deadLetters).hasSize(1);
        assertThat(deadLetters.get(0).message().id()).isEqualTo(id);
        assertThat(deadLetters.get(0).deliveryAttempts()).isEqualTo(2);
    }

    @Test
    void prefix는_stream_이름에_적용되지_않음() throws Exception {
        // given
        adapter = new MemoryCacheAdapter();
        adapter.connect();
        adapter.setPrefix("tenant:");
        List<Message> received = new CopyOnWriteArrayList<>();
        adapter.register("s", received::add);

        // when
        adapter.append(Message.of("s", Map.of("k", "v")).withPrefix("tenant:"));

        // then
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (received.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(adapter.streamNames()).containsExactly("s");
        assertThat(received).hasSize(1);
        assertThat(received.get(0).prefix()).isEqualTo("tenant:");
    }

    @Test
    void lock은_항상_지원되지_않음() {
        // given
        adapter = new MemoryCacheAdapter();

        // when & then
        assertThatThrownBy(() -> adapter.lock("k", 10, null))
            .hasMessage("memory not support lock");
    }

    @Test
    void null_인자는_거부됨() {
        assertThatThrownBy(() -> new MemoryCacheAdapter(null, new ShutdownSignal()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
        assertThatThrownBy(() -> new MemoryCacheAdapter(new MemoryAdapterConfig(), null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("signal cannot be null");
    }
}
