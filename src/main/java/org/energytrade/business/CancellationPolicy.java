package org.energytrade.business;

import org.energytrade.config.TradeProperties;
import org.energytrade.domain.CancelParty;
import org.energytrade.domain.TradeOrder;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 取消规则（买卖双方不对称）
 * - 买方窗口外取消：免费，全额退款
 * - 买方窗口内取消：扣买方违约金，其中一部分补偿卖方
 * - 卖方取消：无论何时都扣卖方违约金，买方全额退款
 */
@Component
public class CancellationPolicy {

    private final TradeProperties properties;

    public CancellationPolicy(TradeProperties properties) {
        this.properties = properties;
    }

    /**
     * 没有交付开始时间的订单按窗口内处理
     */
    public boolean isWithinWindow(TradeOrder order, LocalDateTime now) {
        if (order.getDeliveryStart() == null) {
            return true;
        }
        LocalDateTime windowOpens = order.getDeliveryStart()
                .minusMinutes(properties.getCancellation().getWindowMinutes());
        return !now.isBefore(windowOpens);
    }

    public CancellationOutcome evaluate(TradeOrder order, CancelParty party, LocalDateTime now) {
        TradeProperties.Cancellation rules = properties.getCancellation();
        double total = order.getTotalPrice() == null ? 0 : order.getTotalPrice();
        boolean withinWindow = isWithinWindow(order, now);

        if (party == CancelParty.SELLER) {
            return CancellationOutcome.builder()
                    .cancelledBy(CancelParty.SELLER)
                    .withinWindow(withinWindow)
                    .sellerPenalty(round(total * rules.getSellerPenaltyRate()))
                    .buyerRefund(round(total))
                    .build();
        }

        if (!withinWindow) {
            return CancellationOutcome.builder()
                    .cancelledBy(CancelParty.BUYER)
                    .withinWindow(false)
                    .buyerRefund(round(total))
                    .build();
        }
        double buyerPenalty = round(total * rules.getBuyerPenaltyRate());
        return CancellationOutcome.builder()
                .cancelledBy(CancelParty.BUYER)
                .withinWindow(true)
                .buyerPenalty(buyerPenalty)
                .sellerCompensation(round(buyerPenalty * rules.getSellerCompensationShare()))
                .buyerRefund(round(total - buyerPenalty))
                .build();
    }

    private static double round(double amount) {
        return Math.round(amount * 100.0) / 100.0;
    }
}
