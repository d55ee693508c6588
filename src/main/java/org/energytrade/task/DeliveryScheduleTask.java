package org.energytrade.task;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.business.OrderLifecycleService;
import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.TradeOrder;
import org.energytrade.service.IOrderService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交付调度定时任务
 * - 交付窗口已开始的ACTIVE订单 → DELIVERING
 * - 交付窗口已结束的DELIVERING订单 → DELIVERED
 * 单个订单失败不影响其他订单
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "energy-trade.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class DeliveryScheduleTask {

    private final IOrderService orderService;
    private final OrderLifecycleService orderLifecycleService;

    public DeliveryScheduleTask(IOrderService orderService, OrderLifecycleService orderLifecycleService) {
        this.orderService = orderService;
        this.orderLifecycleService = orderLifecycleService;
    }

    @Scheduled(fixedDelayString = "${energy-trade.scheduling.delivery-fixed-delay-ms:60000}", initialDelay = 10000)
    public void advanceDeliveries() {
        TraceIdUtil.setTraceId(TraceIdUtil.generateTraceId());
        try {
            LocalDateTime now = LocalDateTime.now();

            // ==================== 1. 开始交付 ====================
            List<TradeOrder> starting = orderService.listDue(OrderStatus.ACTIVE, now, false);
            int started = 0;
            for (TradeOrder order : starting) {
                try {
                    orderLifecycleService.startDelivery(order.getId());
                    started++;
                } catch (RuntimeException e) {
                    log.error("[开始交付失败] orderId={}, errorMsg={}, traceId={}",
                            order.getId(), e.getMessage(), TraceIdUtil.getTraceId(), e);
                }
            }

            // ==================== 2. 交付结束 ====================
            List<TradeOrder> ending = orderService.listDue(OrderStatus.DELIVERING, now, true);
            int delivered = 0;
            for (TradeOrder order : ending) {
                try {
                    orderLifecycleService.markDelivered(order.getId());
                    delivered++;
                } catch (RuntimeException e) {
                    log.error("[交付完成失败] orderId={}, errorMsg={}, traceId={}",
                            order.getId(), e.getMessage(), TraceIdUtil.getTraceId(), e);
                }
            }

            if (started + delivered > 0) {
                log.info("[交付调度] started={}, delivered={}, traceId={}", started, delivered, TraceIdUtil.getTraceId());
            }
        } finally {
            TraceIdUtil.clearTraceId();
        }
    }
}
