package org.energytrade.business;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.TradeOrder;
import org.energytrade.exception.InvalidTransitionException;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Component;

/**
 * 订单状态机
 * 唯一的状态变更入口，合法流转表定义在 {@link OrderStatus}
 */
@Slf4j
@Component
public class OrderStateMachine {

    /**
     * 校验并修改内存中的订单状态，持久化由调用方负责
     *
     * @throws InvalidTransitionException 非法流转，携带当前状态与目标状态
     */
    public void transition(TradeOrder order, OrderStatus target) {
        OrderStatus current = order.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            log.warn("[非法状态流转] orderId={}, current={}, attempted={}, traceId={}",
                    order.getId(), current, target, TraceIdUtil.getTraceId());
            throw new InvalidTransitionException("order", order.getId(), current, target);
        }
        order.setStatus(target);
        log.info("[订单状态流转] orderId={}, {} -> {}, traceId={}",
                order.getId(), current, target, TraceIdUtil.getTraceId());
    }

    public void ensureCanTransition(TradeOrder order, OrderStatus target) {
        OrderStatus current = order.getStatus();
        if (current == null || !current.canTransitionTo(target)) {
            throw new InvalidTransitionException("order", order.getId(), current, target);
        }
    }
}
