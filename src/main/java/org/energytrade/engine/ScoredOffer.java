package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 打分后的报价
 * 未通过硬过滤的报价也会返回，matchesFilters=false 并附带原因
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScoredOffer {

    private ScorableOffer offer;

    private double score;

    private ScoreBreakdown breakdown;

    private boolean matchesFilters;

    private List<String> filterReasons;
}
