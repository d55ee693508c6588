package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchingResult {

    /**
     * 通过过滤的在前，按得分降序
     */
    private List<ScoredOffer> allOffers;

    private int eligibleCount;

    /**
     * 得分最高的合格报价，没有则为null
     */
    private ScoredOffer selectedOffer;
}
