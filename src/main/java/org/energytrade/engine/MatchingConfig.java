package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 匹配引擎权重与阈值
 * 三个权重之和应为1.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchingConfig {

    @Builder.Default
    private double priceWeight = 0.40;

    @Builder.Default
    private double trustWeight = 0.35;

    @Builder.Default
    private double timeWindowFitWeight = 0.25;

    /**
     * 卖方信任分下限，低于此值的报价被过滤
     */
    @Builder.Default
    private double minTrustThreshold = 0.2;

    /**
     * 快照中缺失卖方时采用的信任分
     */
    @Builder.Default
    private double defaultTrustScore = 0.5;

    public double weightSum() {
        return priceWeight + trustWeight + timeWindowFitWeight;
    }

    public static MatchingConfig defaults() {
        return MatchingConfig.builder().build();
    }
}
