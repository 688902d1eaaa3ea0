package com.ryuqq.cachequeue.adapter.inmemory;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MemoryAdapterConfig 테스트.
 *
 * @author Cachequeue Team
 * @since 1.0.0
 */
class MemoryAdapterConfigTest {

    @Test
    void 기본_생성자는_기본값을_사용함() {
        // when
        MemoryAdapterConfig config = new MemoryAdapterConfig();

        // then
        assertThat(config.streamCapacity()).isZero();
        assertThat(config.maxDeliveryAttempts()).isZero();
        assertThat(config.receivePollIntervalMs()).isEqualTo(50);
    }

    @Test
    void with_메서드는_해당_필드만_변경한_새_설정을_반환함() {
        // given
        MemoryAdapterConfig config = new MemoryAdapterConfig();

        // when
        MemoryAdapterConfig changed = config
            .withStreamCapacity(128)
            .withMaxDeliveryAttempts(5)
            .withReceivePollIntervalMs(20);

        // then
        assertThat(changed).isEqualTo(new MemoryAdapterConfig(128, 5, 20));
        assertThat(config).isEqualTo(new MemoryAdapterConfig());
    }

    @Test
    void 음수_streamCapacity는_거부됨() {
        assertThatThrownBy(() -> new MemoryAdapterConfig(-1, 0, 50))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("streamCapacity cannot be negative (current: -1)");
    }

    @Test
    void 음수_maxDeliveryAttempts는_거부됨() {
        assertThatThrownBy(() -> new MemoryAdapterConfig(0, -3, 50))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 양수가_아닌_polling_간격은_거부됨() {
        assertThatThrownBy(() -> new MemoryAdapterConfig().withReceivePollIntervalMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("must be positive");
    }
}
