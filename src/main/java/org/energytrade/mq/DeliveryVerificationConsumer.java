package org.energytrade.mq;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.business.OrderLifecycleService;
import org.energytrade.config.RabbitMQConfig;
import org.energytrade.event.DeliveryVerificationEvent;
import org.energytrade.exception.TradeException;
import org.energytrade.util.TraceIdUtil;
import org.springframework.amqp.AmqpRejectAndDontRequeueException;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 交付核验事件消费者
 * - 订单已核验过的事件直接忽略（由订单的 delivery_verified 标记保证幂等）
 * - 业务校验失败（订单不存在、状态非法）记录后丢弃，不再重试
 * - 其他异常拒绝消息，进入死信队列延迟重试
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true", matchIfMissing = false)
public class DeliveryVerificationConsumer {

    private final OrderLifecycleService orderLifecycleService;

    public DeliveryVerificationConsumer(OrderLifecycleService orderLifecycleService) {
        this.orderLifecycleService = orderLifecycleService;
    }

    @RabbitListener(queues = RabbitMQConfig.DELIVERY_VERIFICATION_QUEUE)
    public void consume(DeliveryVerificationEvent event) {
        TraceIdUtil.setTraceId(event.getTraceId() != null ? event.getTraceId() : TraceIdUtil.generateTraceId());
        String traceId = TraceIdUtil.getTraceId();
        log.info("[消费交付核验事件] messageId={}, orderId={}, deliveredQty={}, traceId={}",
                event.getMessageId(), event.getOrderId(), event.getDeliveredQty(), traceId);
        try {
            if (event.getOrderId() == null || event.getDeliveredQty() == null) {
                log.warn("[交付核验事件无效] messageId={}, traceId={}", event.getMessageId(), traceId);
                return;
            }
            orderLifecycleService.applyDeliveryVerification(event.getOrderId(), event.getDeliveredQty());
        } catch (TradeException e) {
            log.warn("[交付核验事件丢弃] messageId={}, orderId={}, errorCode={}, errorMsg={}, traceId={}",
                    event.getMessageId(), event.getOrderId(), e.getErrorCode().getCode(), e.getMessage(), traceId);
        } catch (RuntimeException e) {
            log.error("[交付核验事件处理失败] messageId={}, orderId={}, errorMsg={}, traceId={}",
                    event.getMessageId(), event.getOrderId(), e.getMessage(), traceId, e);
            throw new AmqpRejectAndDontRequeueException("处理交付核验事件失败", e);
        } finally {
            TraceIdUtil.clearTraceId();
        }
    }
}
