package org.energytrade.engine;

import lombok.Getter;

/**
 * 信任等级表
 * 按阈值升序排列，分数落在 [minScore, 下一档minScore) 即属于该档
 */
@Getter
public enum TrustTier {

    NEW(0.0, 10, "New", "Limited Trading"),
    STARTER(0.3, 20, "Starter", "Basic Trading"),
    BRONZE(0.5, 40, "Bronze", "Standard Trading"),
    SILVER(0.7, 60, "Silver", "Extended Trading"),
    GOLD(0.85, 80, "Gold", "Advanced Trading"),
    PLATINUM(0.95, 100, "Platinum", "Full Trading");

    private final double minScore;
    private final int allowedLimit;
    private final String displayName;
    private final String privilege;

    TrustTier(double minScore, int allowedLimit, String displayName, String privilege) {
        this.minScore = minScore;
        this.allowedLimit = allowedLimit;
        this.displayName = displayName;
        this.privilege = privilege;
    }

    public static TrustTier of(double score) {
        TrustTier[] tiers = values();
        for (int i = tiers.length - 1; i >= 0; i--) {
            if (score >= tiers[i].minScore) {
                return tiers[i];
            }
        }
        return NEW;
    }

    /**
     * 下一档，最高档返回null
     */
    public TrustTier next() {
        int index = ordinal() + 1;
        return index < values().length ? values()[index] : null;
    }
}
