package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * select / init / confirm 消息体，一个订单对应一个报价
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderMessage {

    private OrderSelection order;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OrderSelection {
        private String itemId;
        private String offerId;
        private Integer quantity;
        /**
         * select 阶段可为空，init/confirm 必填
         */
        private String buyerId;
    }
}
