package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 参与匹配的报价快照
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScorableOffer {

    private String offerId;

    private String itemId;

    private String providerId;

    private String sourceType;

    private double price;

    private String currency;

    /**
     * 当前AVAILABLE区块数
     */
    private int availableBlocks;

    private TimeWindow timeWindow;
}
