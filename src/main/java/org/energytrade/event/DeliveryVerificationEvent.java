package org.energytrade.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交付核验事件
 * 由电表数据侧发布，携带订单的实际交付量
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeliveryVerificationEvent {
    /**
     * 消息ID（唯一）
     */
    private String messageId;

    private String orderId;

    /**
     * 实际交付量（区块）
     */
    private Double deliveredQty;

    /**
     * 电表ID
     */
    private String meterId;

    /**
     * 追踪ID
     */
    private String traceId;

    /**
     * 事件时间戳
     */
    private Long timestamp;
}
