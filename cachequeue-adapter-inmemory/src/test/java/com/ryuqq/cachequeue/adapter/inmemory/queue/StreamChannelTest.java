package com.ryuqq.cachequeue.adapter.inmemory.queue;

import com.ryuqq.cachequeue.core.model.Message;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * StreamChannel 단위 테스트.
 *
 * <p>상태 전이 (ACTIVE → DRAINING → STOPPED)와 enqueue lane 동작을 검증합니다.</p>
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
class StreamChannelTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(1, TimeUnit.SECONDS);
    }

    @Test
    void enqueue된_메시지는_FIFO로_수신됨() throws Exception {
        // given
        StreamChannel channel = new StreamChannel("s", 0, Runnable::run, 10);

        // when
        channel.enqueue(delivery("1"));
        channel.enqueue(delivery("2"));

        // then
        assertThat(channel.receive().message().id()).isEqualTo("1");
        assertThat(channel.receive().message().id()).isEqualTo("2");
    }

    @Test
    void bounded_buffer가_가득_차도_호출자는_대기하지_않음() throws Exception {
        // given
        StreamChannel channel = new StreamChannel("s", 1, executor, 10);

        // when: 용량 1에 3개 추가
        long started = System.nanoTime();
        channel.enqueue(delivery("1"));
        channel.enqueue(delivery("2"));
        channel.enqueue(delivery("3"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // then
        assertThat(elapsedMs).isLessThan(1000);
        assertThat(channel.receive().message().id()).isEqualTo("1");
        assertThat(channel.receive().message().id()).isEqualTo("2");
        assertThat(channel.receive().message().id()).isEqualTo("3");
    }

    @Test
    void consumer_없이_close하면_즉시_STOPPED이고_메시지는_폐기됨() throws Exception {
        // given
        StreamChannel channel = new StreamChannel("s", 0, Runnable::run, 10);
        channel.enqueue(delivery("1"));

        // when
        channel.close();

        // then
        assertThat(channel.state()).isEqualTo(StreamState.STOPPED);
        assertThat(channel.size()).isZero();
        assertThat(channel.receive()).isNull();
    }

    @Test
    void consumer가_있으면_DRAINING_후_잔여_메시지_전달_뒤_STOPPED() throws Exception {
        // given
        StreamChannel channel = new StreamChannel("s", 0, Runnable::run, 10);
        channel.attachConsumer();
        channel.enqueue(delivery("1"));

        // when
        channel.close();

        // then
        assertThat(channel.state()).isEqualTo(StreamState.DRAINING);
        assertThat(channel.receive().message().id()).isEqualTo("1");
        assertThat(channel.receive()).isNull();

        channel.detachConsumer();
        assertThat(channel.state()).isEqualTo(StreamState.STOPPED);
    }

    @Test
    void DRAINING_중_requeue는_거부됨() {
        // given
        StreamChannel channel = new StreamChannel("s", 0, Runnable::run, 10);
        channel.attachConsumer();
        channel.close();

        // when
        boolean requeued = channel.requeue(delivery("1").next());

        // then
        assertThat(requeued).isFalse();
        assertThat(channel.size()).isZero();
    }

    @Test
    void 종료된_stream에_enqueue나_consumer_등록_시_예외_발생() {
        // given
        StreamChannel channel = new StreamChannel("s", 0, Runnable::run, 10);
        channel.close();

        // when & then
        assertThatThrownBy(() -> channel.enqueue(delivery("1")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("STOPPED");
        assertThatThrownBy(channel::attachConsumer)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void close는_멱등함() {
        // given
        StreamChannel channel = new StreamChannel("s", 0, Runnable::run, 10);
        channel.attachConsumer();

        // when
        channel.close();
        channel.close();

        // then
        assertThat(channel.state()).isEqualTo(StreamState.DRAINING);
    }

    private static Delivery delivery(String id) {
        return new Delivery(new Message(id, "s", Map.of("v", id)), 1);
    }
}
