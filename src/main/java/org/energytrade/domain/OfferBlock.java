package org.energytrade.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 能源区块：最小不可分割的交易单位
 * - order_id 非空时状态必须为 RESERVED 或 SOLD（数据库CHECK约束）
 * - version 由数据库触发器在每次更新时自增
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("offer_blocks")
public class OfferBlock {
    /**
     * 格式 block-{offerId}-{seq}
     */
    @TableId(type = IdType.INPUT)
    private String id;
    private String offerId;
    private String itemId;
    private String providerId;
    /**
     * 创建序号，用于同一批次内的先进先出
     */
    private Integer seq;
    private BlockStatus status;
    private String orderId;
    private String transactionId;
    /**
     * 乐观锁版本号（触发器维护）
     */
    private Long version;
    /**
     * 价格快照
     */
    private Double priceValue;
    private String currency;
    /**
     * 时间窗口快照
     */
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private LocalDateTime reservedAt;
    private LocalDateTime soldAt;
    private LocalDateTime createTime;
}
