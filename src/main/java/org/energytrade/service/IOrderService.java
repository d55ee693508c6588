package org.energytrade.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.TradeOrder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 订单数据服务
 * 状态流转规则在 business.OrderStateMachine，这里只负责读写
 */
public interface IOrderService extends IService<TradeOrder> {

    /**
     * @throws org.energytrade.exception.ValidationException 订单不存在
     */
    TradeOrder getRequired(String orderId);

    TradeOrder findByTransaction(String transactionId);

    /**
     * 带版本号更新
     *
     * @throws org.energytrade.exception.ConflictException 版本不匹配
     */
    void updateWithVersion(TradeOrder order);

    /**
     * 指定状态下、时间点已到的订单（交付开始或结束）
     */
    List<TradeOrder> listDue(OrderStatus status, LocalDateTime now, boolean byDeliveryEnd);

    /**
     * 买方未结束订单的区块总数
     */
    long openQuantityOfBuyer(String buyerId);
}
