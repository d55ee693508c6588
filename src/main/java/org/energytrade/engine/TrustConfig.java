package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 信任引擎静态参数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrustConfig {

    /**
     * 新参与方的初始信任分
     */
    @Builder.Default
    private double defaultScore = 0.3;

    /**
     * 新参与方的初始可交易比例（%）
     */
    @Builder.Default
    private int defaultLimit = 10;

    /**
     * 足额交付奖励
     */
    @Builder.Default
    private double successBonus = 0.02;

    /**
     * 零交付时的最大惩罚
     */
    @Builder.Default
    private double failurePenalty = 0.10;

    /**
     * 买方窗口期内取消的基础惩罚
     */
    @Builder.Default
    private double cancelPenalty = 0.03;

    /**
     * 卖方取消的基础惩罚
     */
    @Builder.Default
    private double sellerCancelPenalty = 0.05;

    public static TrustConfig defaults() {
        return TrustConfig.builder().build();
    }
}
