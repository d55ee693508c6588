package org.energytrade.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * 信任引擎单元测试
 */
class TrustEngineTest {

    private static final double EPS = 1e-9;

    private final TrustEngine engine = new TrustEngine(TrustConfig.defaults());

    @ParameterizedTest
    @CsvSource({
            "0.0, 10",
            "0.29, 10",
            "0.3, 20",
            "0.5, 40",
            "0.7, 60",
            "0.85, 80",
            "0.95, 100",
            "1.0, 100"
    })
    @DisplayName("信任分映射到可交易比例")
    void allowedLimitFollowsTierTable(double score, int expectedLimit) {
        assertThat(engine.allowedLimit(score)).isEqualTo(expectedLimit);
    }

    @Test
    @DisplayName("可交易数量 = 申报容量 × 比例")
    void allowedTradeQuantity() {
        assertThat(engine.allowedTradeQuantity(100, 0.5)).isCloseTo(40.0, within(EPS));
        assertThat(engine.allowedTradeQuantity(0, 0.9)).isZero();
    }

    @Test
    @DisplayName("足额交付加分，不超过成功奖励")
    void fullDeliveryAddsCappedBonus() {
        TrustUpdate update = engine.updateAfterDelivery(0.5, 12, 10);

        assertThat(update.getNewScore()).isCloseTo(0.52, within(EPS));
        assertThat(update.getTrustImpact()).isCloseTo(0.02, within(EPS));
    }

    @Test
    @DisplayName("交付短缺按短缺比例扣分")
    void partialDeliveryIsPenalizedByShortfall() {
        TrustUpdate update = engine.updateAfterDelivery(0.5, 5, 10);

        // 0.10 × (1 - 5/10) = 0.05
        assertThat(update.getNewScore()).isCloseTo(0.45, within(EPS));
        assertThat(engine.deliveryPenalty(10, 0, 0.10)).isCloseTo(0.10, within(EPS));
    }

    @Test
    @DisplayName("应交付量为0时分数不变")
    void zeroExpectedQuantityLeavesScoreUnchanged() {
        TrustUpdate update = engine.updateAfterDelivery(0.6, 3, 0);

        assertThat(update.getNewScore()).isCloseTo(0.6, within(EPS));
        assertThat(update.getTrustImpact()).isZero();
    }

    @Test
    @DisplayName("买方窗口外取消不扣分，窗口内按比例扣分")
    void buyerCancelOnlyPenalizedInsideWindow() {
        assertThat(engine.updateAfterCancel(0.5, 10, 10, false).getTrustImpact()).isZero();

        TrustUpdate full = engine.updateAfterCancel(0.5, 10, 10, true);
        assertThat(full.getNewScore()).isCloseTo(0.47, within(EPS));

        TrustUpdate half = engine.updateAfterCancel(0.5, 5, 10, true);
        assertThat(half.getNewScore()).isCloseTo(0.485, within(EPS));

        // 总量为0按全额取消
        assertThat(engine.updateAfterCancel(0.5, 0, 0, true).getNewScore()).isCloseTo(0.47, within(EPS));
    }

    @Test
    @DisplayName("卖方取消总是扣分")
    void sellerCancelAlwaysPenalized() {
        TrustUpdate update = engine.updateAfterSellerCancel(0.5, 10, 10);

        assertThat(update.getNewScore()).isCloseTo(0.45, within(EPS));
    }

    @Test
    @DisplayName("核验质量决定加分幅度")
    void verificationBonusScalesWithQuality() {
        assertThat(engine.updateAfterVerificationQuality(0.3, VerificationQuality.HIGH).getTrustImpact())
                .isCloseTo(0.02, within(EPS));
        assertThat(engine.updateAfterVerificationQuality(0.3, VerificationQuality.MEDIUM).getTrustImpact())
                .isCloseTo(0.012, within(EPS));
        assertThat(engine.updateAfterVerificationQuality(0.3, null).getTrustImpact())
                .isCloseTo(0.006, within(EPS));
    }

    @Test
    @DisplayName("分数与影响值无浮点尾差，连续累加结果精确")
    void scoresCarryNoFloatingPointTail() {
        TrustUpdate update = engine.updateAfterVerificationQuality(0.3, VerificationQuality.HIGH);

        assertThat(update.getNewScore()).isEqualTo(0.32);
        assertThat(update.getTrustImpact()).isEqualTo(0.02);

        double score = 0.3;
        for (int i = 0; i < 20; i++) {
            score = engine.updateAfterDelivery(score, 10, 10).getNewScore();
        }
        assertThat(score).isEqualTo(0.7);
    }

    @ParameterizedTest
    @CsvSource({
            "1.0, 20, 10",
            "0.0, 0, 10",
            "0.99, 20, 0",
            "0.01, 0, 10"
    })
    @DisplayName("任何更新后分数都在 [0,1] 内")
    void scoresStayClamped(double score, double delivered, double expected) {
        assertThat(engine.updateAfterDelivery(score, delivered, expected).getNewScore()).isBetween(0.0, 1.0);
        assertThat(engine.updateAfterCancel(score, delivered, expected, true).getNewScore()).isBetween(0.0, 1.0);
        assertThat(engine.updateAfterSellerCancel(score, delivered, expected).getNewScore()).isBetween(0.0, 1.0);
        assertThat(engine.updateAfterVerificationQuality(score, VerificationQuality.HIGH).getNewScore())
                .isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("越界和NaN输入被钳制")
    void outOfRangeInputIsClamped() {
        assertThat(engine.updateAfterDelivery(1.7, 10, 10).getNewScore()).isEqualTo(1.0);
        assertThat(engine.updateAfterSellerCancel(-0.4, 1, 1).getNewScore()).isEqualTo(0.0);
        assertThat(TrustEngine.clamp(Double.NaN)).isZero();
    }

    @Test
    @DisplayName("等级描述与下一档进度")
    void tierDescriptionAndProgress() {
        assertThat(engine.tierDescription(0.97)).isEqualTo("Platinum (Full Trading)");
        assertThat(engine.tierDescription(0.6)).isEqualTo("Bronze (Standard Trading)");

        TierProgress progress = engine.nextTierProgress(0.6);
        assertThat(progress.getCurrentTier()).isEqualTo("Bronze");
        assertThat(progress.getNextTier()).isEqualTo("Silver");
        assertThat(progress.getProgressPercent()).isEqualTo(50);
        assertThat(progress.getScoreNeeded()).isCloseTo(0.1, within(EPS));

        TierProgress top = engine.nextTierProgress(1.0);
        assertThat(top.getNextTier()).isNull();
        assertThat(top.getProgressPercent()).isEqualTo(100);
    }

    @Test
    @DisplayName("核验质量按容量比值判定")
    void verificationQualityFromCapacity() {
        assertThat(VerificationQuality.fromCapacity(95.0, 100.0)).isEqualTo(VerificationQuality.HIGH);
        assertThat(VerificationQuality.fromCapacity(85.0, 100.0)).isEqualTo(VerificationQuality.MEDIUM);
        assertThat(VerificationQuality.fromCapacity(50.0, 100.0)).isEqualTo(VerificationQuality.LOW);
        assertThat(VerificationQuality.fromCapacity(50.0, 0.0)).isEqualTo(VerificationQuality.LOW);
    }
}
