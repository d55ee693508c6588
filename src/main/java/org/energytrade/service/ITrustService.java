package org.energytrade.service;

import org.energytrade.engine.TrustUpdate;

/**
 * 信任分落库服务
 * 调用信任引擎计算新分数，写回卖方/参与方并记录历史
 */
public interface ITrustService {

    /**
     * 交付核验结果：更新卖方信任分与订单统计
     */
    TrustUpdate applyDeliveryOutcome(String providerId, String orderId, double deliveredQty, double expectedQty);

    /**
     * 买方取消：只在取消窗口内扣分
     */
    TrustUpdate applyBuyerCancel(String buyerId, String orderId, double cancelledQty, double totalQty,
                                 boolean withinCancelWindow);

    /**
     * 卖方取消：总是扣分
     */
    TrustUpdate applySellerCancel(String providerId, String orderId, double cancelledQty, double totalQty);

    /**
     * 入驻核验：按核验容量与申报容量的比值给予一次性加分
     */
    TrustUpdate applyVerification(String participantId, Double verifiedCapacity);
}
