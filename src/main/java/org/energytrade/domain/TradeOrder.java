package org.energytrade.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.annotation.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("orders")
public class TradeOrder {
    @TableId(type = IdType.INPUT)
    private String id;
    /**
     * 协议事务ID
     */
    private String transactionId;
    private String buyerId;
    private String providerId;
    private String offerId;
    private String itemId;
    /**
     * 区块数量
     */
    private Integer quantity;
    private Double totalPrice;
    private String currency;
    private OrderStatus status;
    /**
     * 乐观锁版本号
     */
    @Version
    private Long version;
    /**
     * 计划交付窗口
     */
    private LocalDateTime deliveryStart;
    private LocalDateTime deliveryEnd;

    // ==================== 取消信息 ====================
    private CancelParty cancelledBy;
    private String cancelReason;
    private Boolean cancelWithinWindow;
    private Double buyerPenalty;
    private Double sellerPenalty;
    private Double sellerCompensation;
    private Double buyerRefund;
    private LocalDateTime cancelledAt;

    // ==================== 交付核验 ====================
    private Double deliveredQty;
    private Boolean deliveryVerified;

    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
