package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 报价单：单价 × 数量
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Quote {
    private String offerId;
    private String itemId;
    private String providerId;
    private String buyerId;
    private int quantity;
    private double unitPrice;
    private double totalPrice;
    private String currency;
    private int availableQuantity;
}
