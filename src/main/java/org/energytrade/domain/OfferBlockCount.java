package org.energytrade.domain;

import lombok.Data;

/**
 * 按报价、状态聚合的区块数
 */
@Data
public class OfferBlockCount {
    private String offerId;
    private BlockStatus status;
    private Long blockCount;
}
