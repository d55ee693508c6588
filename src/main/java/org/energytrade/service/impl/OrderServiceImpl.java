package org.energytrade.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.TradeOrder;
import org.energytrade.exception.ConflictException;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.ValidationException;
import org.energytrade.mapper.TradeOrderMapper;
import org.energytrade.service.IOrderService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class OrderServiceImpl extends ServiceImpl<TradeOrderMapper, TradeOrder> implements IOrderService {

    private final TradeOrderMapper tradeOrderMapper;

    public OrderServiceImpl(TradeOrderMapper tradeOrderMapper) {
        this.tradeOrderMapper = tradeOrderMapper;
    }

    @Override
    public TradeOrder getRequired(String orderId) {
        TradeOrder order = orderId == null ? null : getById(orderId);
        if (order == null) {
            throw new ValidationException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId);
        }
        return order;
    }

    @Override
    public TradeOrder findByTransaction(String transactionId) {
        if (transactionId == null) {
            return null;
        }
        return lambdaQuery()
                .eq(TradeOrder::getTransactionId, transactionId)
                .orderByDesc(TradeOrder::getCreateTime)
                .last("LIMIT 1")
                .one();
    }

    @Override
    public void updateWithVersion(TradeOrder order) {
        order.setUpdateTime(LocalDateTime.now());
        // @Version 乐观锁：WHERE version = #{version}
        boolean updated = updateById(order);
        if (!updated) {
            log.warn("[乐观锁冲突] 订单更新失败，orderId={}, version={}, traceId={}",
                    order.getId(), order.getVersion(), TraceIdUtil.getTraceId());
            throw new ConflictException("Order " + order.getId() + " was modified concurrently");
        }
    }

    @Override
    public List<TradeOrder> listDue(OrderStatus status, LocalDateTime now, boolean byDeliveryEnd) {
        return lambdaQuery()
                .eq(TradeOrder::getStatus, status)
                .le(byDeliveryEnd ? TradeOrder::getDeliveryEnd : TradeOrder::getDeliveryStart, now)
                .orderByAsc(TradeOrder::getCreateTime)
                .list();
    }

    @Override
    public long openQuantityOfBuyer(String buyerId) {
        return tradeOrderMapper.sumOpenQuantityByBuyer(buyerId);
    }
}
