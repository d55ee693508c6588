package org.energytrade.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 距离下一信任等级的进度，仅用于展示
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TierProgress {

    private String currentTier;

    /**
     * 已是最高档时为null
     */
    private String nextTier;

    /**
     * 当前档内的进度百分比（0-100）
     */
    private int progressPercent;

    /**
     * 升档还差的分数
     */
    private double scoreNeeded;
}
