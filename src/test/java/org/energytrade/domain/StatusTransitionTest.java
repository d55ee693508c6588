package org.energytrade.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 订单/区块流转表
 */
class StatusTransitionTest {

    @Test
    @DisplayName("订单正向流转")
    void orderHappyPath() {
        assertThat(OrderStatus.DRAFT.canTransitionTo(OrderStatus.PENDING)).isTrue();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.ACTIVE)).isTrue();
        assertThat(OrderStatus.ACTIVE.canTransitionTo(OrderStatus.DELIVERING)).isTrue();
        assertThat(OrderStatus.DELIVERING.canTransitionTo(OrderStatus.DELIVERED)).isTrue();
        assertThat(OrderStatus.DELIVERED.canTransitionTo(OrderStatus.COMPLETED)).isTrue();
    }

    @Test
    @DisplayName("只有 ACTIVE 和 DELIVERING 可以取消")
    void cancellationOnlyFromActiveOrDelivering() {
        for (OrderStatus status : OrderStatus.values()) {
            boolean expected = status == OrderStatus.ACTIVE || status == OrderStatus.DELIVERING;
            assertThat(status.canTransitionTo(OrderStatus.CANCELLED)).as(status.name()).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("终态不可再流转")
    void terminalStates() {
        assertThat(OrderStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(OrderStatus.CANCELLED.isTerminal()).isTrue();
        assertThat(OrderStatus.CANCELLED.allowedTargets()).isEmpty();
        assertThat(OrderStatus.ACTIVE.isTerminal()).isFalse();
        assertThat(OrderStatus.ACTIVE.canTransitionTo(null)).isFalse();
        assertThat(OrderStatus.ACTIVE.canTransitionTo(OrderStatus.COMPLETED)).isFalse();
    }

    @Test
    @DisplayName("区块只能 AVAILABLE→RESERVED→SOLD 或释放回 AVAILABLE")
    void blockTransitions() {
        assertThat(BlockStatus.AVAILABLE.allowedTargets()).containsExactly(BlockStatus.RESERVED);
        assertThat(BlockStatus.RESERVED.allowedTargets())
                .containsExactlyInAnyOrder(BlockStatus.SOLD, BlockStatus.AVAILABLE);
        assertThat(BlockStatus.SOLD.allowedTargets()).isEmpty();
        assertThat(BlockStatus.AVAILABLE.canTransitionTo(BlockStatus.SOLD)).isFalse();
        assertThat(BlockStatus.AVAILABLE.requiresOrder()).isFalse();
        assertThat(BlockStatus.SOLD.requiresOrder()).isTrue();
    }
}
