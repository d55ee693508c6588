package org.energytrade.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("offers")
public class Offer {
    @TableId(type = IdType.INPUT)
    private String id;
    private String itemId;
    private String providerId;
    /**
     * 单价（每区块）
     */
    private Double priceValue;
    private String currency;
    /**
     * 上架数量，仅作描述，实际可售量以AVAILABLE区块数为准
     */
    private Integer maxQty;
    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    /**
     * 计价方式，例如 PER_KWH
     */
    private String pricingModel;
    /**
     * 结算方式，例如 DAILY
     */
    private String settlementType;
    private OfferStatus status;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
