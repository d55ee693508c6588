package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 信任分更新结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrustUpdate {

    private double previousScore;

    private double newScore;

    private int newLimit;

    /**
     * 实际生效的变化量（正为奖励，负为惩罚）
     */
    private double trustImpact;
}
