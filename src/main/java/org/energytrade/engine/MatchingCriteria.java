package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 买方意图
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchingCriteria {

    private int requestedQuantity;

    /**
     * 为空表示不限时间
     */
    private TimeWindow requestedTimeWindow;

    /**
     * 为空表示不限价格
     */
    private Double maxPrice;
}
