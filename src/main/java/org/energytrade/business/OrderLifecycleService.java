package org.energytrade.business;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.CancelParty;
import org.energytrade.domain.OrderStatus;
import org.energytrade.domain.TradeOrder;
import org.energytrade.exception.ValidationException;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.service.IOrderService;
import org.energytrade.service.ITrustService;
import org.energytrade.util.DistributedLockUtil;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * 订单生命周期服务 - 业务编排层
 *
 * 职责：
 * 1. 确认下单：预留区块 + 创建ACTIVE订单
 * 2. 取消：按发起方计算违约金，释放区块，调整信任分
 * 3. 交付：ACTIVE → DELIVERING（区块售出）→ DELIVERED
 * 4. 交付核验：DELIVERED → COMPLETED，并按交付比例调整卖方信任分
 *
 * 同一订单的状态变更加分布式锁，订单表另有版本号兜底
 */
@Slf4j
@Service
public class OrderLifecycleService {

    private static final String ORDER_LOCK_PREFIX = "order:";

    private final IOrderService orderService;
    private final IBlockLedgerService blockLedgerService;
    private final ITrustService trustService;
    private final OrderStateMachine stateMachine;
    private final CancellationPolicy cancellationPolicy;

    public OrderLifecycleService(IOrderService orderService,
                                 IBlockLedgerService blockLedgerService,
                                 ITrustService trustService,
                                 OrderStateMachine stateMachine,
                                 CancellationPolicy cancellationPolicy) {
        this.orderService = orderService;
        this.blockLedgerService = blockLedgerService;
        this.trustService = trustService;
        this.stateMachine = stateMachine;
        this.cancellationPolicy = cancellationPolicy;
    }

    /**
     * 确认下单
     * - 同一事务ID重复确认时直接返回已有订单
     * - 区块预留在独立事务中完成，订单落库失败时释放区块
     */
    public ConfirmedOrder confirmOrder(OrderDraft draft) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. 幂等：同一事务已有订单 ====================
        TradeOrder existing = orderService.findByTransaction(draft.getTransactionId());
        if (existing != null && Objects.equals(existing.getOfferId(), draft.getOfferId())
                && existing.getStatus() != OrderStatus.CANCELLED) {
            log.info("[重复确认] transactionId={}, orderId={}, traceId={}",
                    draft.getTransactionId(), existing.getId(), traceId);
            List<String> blockIds = blockLedgerService.listByOrder(existing.getId()).stream()
                    .map(block -> block.getId())
                    .toList();
            return new ConfirmedOrder(existing, blockIds);
        }

        // ==================== 2. 预留区块 ====================
        String orderId = "order-" + UUID.randomUUID();
        List<String> blockIds = blockLedgerService.claim(
                draft.getOfferId(), draft.getQuantity(), orderId, draft.getTransactionId());

        // ==================== 3. 创建订单 ====================
        LocalDateTime now = LocalDateTime.now();
        TradeOrder order = TradeOrder.builder()
                .id(orderId)
                .transactionId(draft.getTransactionId())
                .buyerId(draft.getBuyerId())
                .providerId(draft.getProviderId())
                .offerId(draft.getOfferId())
                .itemId(draft.getItemId())
                .quantity(draft.getQuantity())
                .totalPrice(draft.getTotalPrice())
                .currency(draft.getCurrency())
                .status(OrderStatus.PENDING)
                .version(0L)
                .deliveryStart(draft.getDeliveryStart())
                .deliveryEnd(draft.getDeliveryEnd())
                .deliveryVerified(false)
                .createTime(now)
                .updateTime(now)
                .build();
        stateMachine.transition(order, OrderStatus.ACTIVE);
        try {
            orderService.save(order);
        } catch (RuntimeException e) {
            log.error("[订单创建失败] 释放已预留区块，orderId={}, blockCount={}, errorMsg={}, traceId={}",
                    orderId, blockIds.size(), e.getMessage(), traceId, e);
            blockLedgerService.release(blockIds);
            throw e;
        }
        log.info("[订单创建成功] orderId={}, transactionId={}, offerId={}, quantity={}, totalPrice={}, traceId={}",
                orderId, draft.getTransactionId(), draft.getOfferId(), draft.getQuantity(), draft.getTotalPrice(), traceId);
        return new ConfirmedOrder(order, blockIds);
    }

    @Transactional(rollbackFor = Exception.class)
    public TradeOrder cancelByBuyer(String orderId, String buyerId, String reason) {
        return DistributedLockUtil.executeWithLock(ORDER_LOCK_PREFIX + orderId, 10, 30, TimeUnit.SECONDS, () -> {
            TradeOrder order = orderService.getRequired(orderId);
            if (buyerId != null && !buyerId.equals(order.getBuyerId())) {
                throw new ValidationException("Order " + orderId + " does not belong to buyer " + buyerId);
            }
            CancellationOutcome outcome = cancel(order, CancelParty.BUYER, reason);
            trustService.applyBuyerCancel(order.getBuyerId(), orderId,
                    order.getQuantity(), order.getQuantity(), outcome.isWithinWindow());
            return order;
        });
    }

    @Transactional(rollbackFor = Exception.class)
    public TradeOrder cancelBySeller(String orderId, String providerId, String reason) {
        return DistributedLockUtil.executeWithLock(ORDER_LOCK_PREFIX + orderId, 10, 30, TimeUnit.SECONDS, () -> {
            TradeOrder order = orderService.getRequired(orderId);
            if (providerId != null && !providerId.equals(order.getProviderId())) {
                throw new ValidationException("Order " + orderId + " does not belong to provider " + providerId);
            }
            cancel(order, CancelParty.SELLER, reason);
            trustService.applySellerCancel(order.getProviderId(), orderId, order.getQuantity(), order.getQuantity());
            return order;
        });
    }

    private CancellationOutcome cancel(TradeOrder order, CancelParty party, String reason) {
        // ==================== 1. 状态校验 ====================
        stateMachine.ensureCanTransition(order, OrderStatus.CANCELLED);
        OrderStatus previous = order.getStatus();
        LocalDateTime now = LocalDateTime.now();

        // ==================== 2. 计算违约金 ====================
        CancellationOutcome outcome = cancellationPolicy.evaluate(order, party, now);

        // ==================== 3. 释放区块（已售出的不回收） ====================
        int released = 0;
        if (previous == OrderStatus.ACTIVE) {
            released = blockLedgerService.releaseForOrder(order.getId());
        }

        // ==================== 4. 更新订单 ====================
        stateMachine.transition(order, OrderStatus.CANCELLED);
        order.setCancelledBy(party);
        order.setCancelReason(reason);
        order.setCancelWithinWindow(outcome.isWithinWindow());
        order.setBuyerPenalty(outcome.getBuyerPenalty());
        order.setSellerPenalty(outcome.getSellerPenalty());
        order.setSellerCompensation(outcome.getSellerCompensation());
        order.setBuyerRefund(outcome.getBuyerRefund());
        order.setCancelledAt(now);
        orderService.updateWithVersion(order);

        log.info("[订单取消] orderId={}, cancelledBy={}, withinWindow={}, buyerPenalty={}, sellerPenalty={}, "
                        + "sellerCompensation={}, releasedBlocks={}, traceId={}",
                order.getId(), party, outcome.isWithinWindow(), outcome.getBuyerPenalty(),
                outcome.getSellerPenalty(), outcome.getSellerCompensation(), released, TraceIdUtil.getTraceId());
        return outcome;
    }

    /**
     * 开始交付：区块 RESERVED → SOLD
     */
    @Transactional(rollbackFor = Exception.class)
    public TradeOrder startDelivery(String orderId) {
        return DistributedLockUtil.executeWithLock(ORDER_LOCK_PREFIX + orderId, 10, 30, TimeUnit.SECONDS, () -> {
            TradeOrder order = orderService.getRequired(orderId);
            stateMachine.transition(order, OrderStatus.DELIVERING);
            int sold = blockLedgerService.finalizeForOrder(orderId);
            orderService.updateWithVersion(order);
            log.info("[开始交付] orderId={}, soldBlocks={}, traceId={}", orderId, sold, TraceIdUtil.getTraceId());
            return order;
        });
    }

    @Transactional(rollbackFor = Exception.class)
    public TradeOrder markDelivered(String orderId) {
        return DistributedLockUtil.executeWithLock(ORDER_LOCK_PREFIX + orderId, 10, 30, TimeUnit.SECONDS, () -> {
            TradeOrder order = orderService.getRequired(orderId);
            stateMachine.transition(order, OrderStatus.DELIVERED);
            orderService.updateWithVersion(order);
            return order;
        });
    }

    /**
     * 交付核验（外部电表数据）
     * - DELIVERED 订单流转到 COMPLETED
     * - 按 实际交付量/应交付量 调整卖方信任分
     * - 同一订单只生效一次
     */
    @Transactional(rollbackFor = Exception.class)
    public TradeOrder applyDeliveryVerification(String orderId, double deliveredQty) {
        if (deliveredQty < 0) {
            throw new ValidationException("Delivered quantity must be non-negative");
        }
        return DistributedLockUtil.executeWithLock(ORDER_LOCK_PREFIX + orderId, 10, 30, TimeUnit.SECONDS, () -> {
            TradeOrder order = orderService.getRequired(orderId);
            if (Boolean.TRUE.equals(order.getDeliveryVerified())) {
                log.warn("[交付核验重复] orderId={}, deliveredQty={}, traceId={}",
                        orderId, order.getDeliveredQty(), TraceIdUtil.getTraceId());
                return order;
            }
            if (order.getStatus() != OrderStatus.COMPLETED) {
                stateMachine.transition(order, OrderStatus.COMPLETED);
            }
            order.setDeliveredQty(deliveredQty);
            order.setDeliveryVerified(true);
            orderService.updateWithVersion(order);

            trustService.applyDeliveryOutcome(order.getProviderId(), orderId, deliveredQty, order.getQuantity());
            log.info("[交付核验完成] orderId={}, deliveredQty={}, expectedQty={}, traceId={}",
                    orderId, deliveredQty, order.getQuantity(), TraceIdUtil.getTraceId());
            return order;
        });
    }
}
