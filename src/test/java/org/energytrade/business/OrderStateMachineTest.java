package org.energytrade.business;

import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.TradeOrder;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.InvalidTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderStateMachineTest {

    private final OrderStateMachine stateMachine = new OrderStateMachine();

    @Test
    @DisplayName("合法流转修改订单状态")
    void legalTransitionUpdatesStatus() {
        TradeOrder order = TradeOrder.builder().id("order-1").status(OrderStatus.ACTIVE).build();

        stateMachine.transition(order, OrderStatus.DELIVERING);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.DELIVERING);
    }

    @Test
    @DisplayName("非法流转抛出异常并携带当前与目标状态")
    void illegalTransitionIsRejected() {
        TradeOrder order = TradeOrder.builder().id("order-2").status(OrderStatus.COMPLETED).build();

        assertThatThrownBy(() -> stateMachine.transition(order, OrderStatus.CANCELLED))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> {
                    InvalidTransitionException ex = (InvalidTransitionException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_TRANSITION);
                    assertThat(ex.getCurrentState()).isEqualTo("COMPLETED");
                    assertThat(ex.getAttemptedState()).isEqualTo("CANCELLED");
                });
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
    }

    @Test
    @DisplayName("状态为空的订单不能流转")
    void nullStatusRejected() {
        TradeOrder order = TradeOrder.builder().id("order-3").build();

        assertThatThrownBy(() -> stateMachine.ensureCanTransition(order, OrderStatus.ACTIVE))
                .isInstanceOf(InvalidTransitionException.class);
    }
}
