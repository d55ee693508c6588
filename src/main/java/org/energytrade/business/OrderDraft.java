package org.energytrade.business;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 确认下单前已校验过的订单要素
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderDraft {
    private String transactionId;
    private String buyerId;
    private String providerId;
    private String offerId;
    private String itemId;
    private int quantity;
    private double totalPrice;
    private String currency;
    private LocalDateTime deliveryStart;
    private LocalDateTime deliveryEnd;
}
