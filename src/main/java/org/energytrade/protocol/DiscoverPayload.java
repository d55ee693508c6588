package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.energytrade.engine.ScoredOffer;

import java.util.List;

/**
 * on_discover 回调体
 * 匹配得分只在本次请求内可比较
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DiscoverPayload {
    private CatalogView catalog;
    private int eligibleCount;
    private String selectedOfferId;
    private List<ScoredOffer> rankedOffers;
}
