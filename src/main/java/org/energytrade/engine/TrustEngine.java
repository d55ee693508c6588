package org.energytrade.engine;

/**
 * 信任引擎
 * - 纯函数，无I/O
 * - 所有结果钳制在 [0,1]
 * - 除数可能为0的地方短路为最保守结果
 */
public class TrustEngine {

    private static final double SCORE_SCALE = 1_000_000d;

    private final TrustConfig config;

    public TrustEngine(TrustConfig config) {
        this.config = config;
    }

    public TrustConfig getConfig() {
        return config;
    }

    /**
     * 信任分对应的可交易比例（申报容量的百分比）
     */
    public int allowedLimit(double score) {
        return TrustTier.of(clamp(score)).getAllowedLimit();
    }

    /**
     * 按申报容量和信任分计算可交易数量
     */
    public double allowedTradeQuantity(double declaredCapacity, double score) {
        if (declaredCapacity <= 0) {
            return 0;
        }
        return declaredCapacity * allowedLimit(score) / 100.0;
    }

    /**
     * 交付短缺惩罚：basePenalty × (1 - min(delivered, expected) / expected)
     */
    public double deliveryPenalty(double expectedQty, double deliveredQty, double basePenalty) {
        if (expectedQty <= 0) {
            return 0;
        }
        double delivered = Math.max(0, Math.min(deliveredQty, expectedQty));
        double shortfallRatio = 1 - delivered / expectedQty;
        return basePenalty * shortfallRatio;
    }

    public TrustUpdate updateAfterDelivery(double score, double deliveredQty, double expectedQty) {
        if (expectedQty <= 0) {
            return unchanged(score);
        }
        double delta;
        if (deliveredQty >= expectedQty) {
            delta = Math.min(config.getSuccessBonus(), config.getSuccessBonus() * (deliveredQty / expectedQty));
        } else {
            delta = -deliveryPenalty(expectedQty, deliveredQty, config.getFailurePenalty());
        }
        return apply(score, delta);
    }

    /**
     * 买方取消：仅在取消窗口内生效，按取消比例扣分
     */
    public TrustUpdate updateAfterCancel(double score, double cancelledQty, double totalQty, boolean withinCancelWindow) {
        return cancelUpdate(score, cancelledQty, totalQty, withinCancelWindow, config.getCancelPenalty());
    }

    /**
     * 卖方取消：任何时候都扣分，基础惩罚更高
     */
    public TrustUpdate updateAfterSellerCancel(double score, double cancelledQty, double totalQty) {
        return cancelUpdate(score, cancelledQty, totalQty, true, config.getSellerCancelPenalty());
    }

    public TrustUpdate updateAfterVerificationQuality(double score, VerificationQuality quality) {
        VerificationQuality effective = quality == null ? VerificationQuality.LOW : quality;
        return apply(score, config.getSuccessBonus() * effective.getFactor());
    }

    public String tierDescription(double score) {
        TrustTier tier = TrustTier.of(clamp(score));
        return tier.getDisplayName() + " (" + tier.getPrivilege() + ")";
    }

    public TierProgress nextTierProgress(double score) {
        double clamped = clamp(score);
        TrustTier current = TrustTier.of(clamped);
        TrustTier next = current.next();
        if (next == null) {
            return TierProgress.builder()
                    .currentTier(current.getDisplayName())
                    .progressPercent(100)
                    .scoreNeeded(0)
                    .build();
        }
        double span = next.getMinScore() - current.getMinScore();
        int progress = (int) Math.round((clamped - current.getMinScore()) / span * 100);
        return TierProgress.builder()
                .currentTier(current.getDisplayName())
                .nextTier(next.getDisplayName())
                .progressPercent(Math.max(0, Math.min(100, progress)))
                .scoreNeeded(Math.max(0, next.getMinScore() - clamped))
                .build();
    }

    private TrustUpdate cancelUpdate(double score, double cancelledQty, double totalQty,
                                     boolean withinCancelWindow, double basePenalty) {
        if (!withinCancelWindow) {
            return unchanged(score);
        }
        // totalQty为0时按全额取消处理
        double ratio = totalQty > 0 ? cancelledQty / totalQty : 1.0;
        ratio = Math.max(0, Math.min(1, ratio));
        return apply(score, -basePenalty * ratio);
    }

    private TrustUpdate apply(double score, double delta) {
        double previous = clamp(score);
        double next = round(clamp(previous + delta));
        return TrustUpdate.builder()
                .previousScore(previous)
                .newScore(next)
                .newLimit(allowedLimit(next))
                .trustImpact(round(next - previous))
                .build();
    }

    /**
     * 分数保留6位小数，消除浮点累加误差
     */
    static double round(double value) {
        return Math.round(value * SCORE_SCALE) / SCORE_SCALE;
    }

    private TrustUpdate unchanged(double score) {
        return apply(score, 0);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }
}
