package org.energytrade.engine;

import org.energytrade.domain.Provider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * 多维加权匹配引擎
 *
 * 处理流程：
 * 1. 硬过滤：时间窗口重叠、至少1个可用区块、价格上限、卖方信任分下限
 * 2. 软打分：score = wPrice·priceScore + wTrust·trustScore + wTime·timeFitScore
 * 3. 排序：合格在前，得分降序，同分按信任分降序，再按offerId升序
 *
 * 价格分只在本次合格集合内归一化，不同请求之间的得分不可比较
 */
public class MatchingEngine {

    public static final String REASON_TIME_WINDOW = "TIME_WINDOW_NO_OVERLAP";
    public static final String REASON_NO_AVAILABILITY = "NO_AVAILABLE_BLOCKS";
    public static final String REASON_PRICE = "PRICE_ABOVE_MAX";
    public static final String REASON_TRUST = "TRUST_BELOW_THRESHOLD";

    private final MatchingConfig config;

    public MatchingEngine(MatchingConfig config) {
        this.config = config;
    }

    public MatchingConfig getConfig() {
        return config;
    }

    public MatchingResult match(List<ScorableOffer> offers, Map<String, Provider> providers, MatchingCriteria criteria) {
        if (offers == null || offers.isEmpty()) {
            return MatchingResult.builder().allOffers(List.of()).eligibleCount(0).build();
        }

        // ==================== 1. 硬过滤 ====================
        List<ScorableOffer> surviving = new ArrayList<>();
        List<List<String>> reasonsByOffer = new ArrayList<>();
        for (ScorableOffer offer : offers) {
            List<String> reasons = filterReasons(offer, providers, criteria);
            reasonsByOffer.add(reasons);
            if (reasons.isEmpty()) {
                surviving.add(offer);
            }
        }

        // ==================== 2. 价格归一化区间 ====================
        List<ScorableOffer> priceBasis = surviving.isEmpty() ? offers : surviving;
        double minPrice = priceBasis.stream().mapToDouble(ScorableOffer::getPrice).min().orElse(0);
        double maxPrice = priceBasis.stream().mapToDouble(ScorableOffer::getPrice).max().orElse(0);

        // ==================== 3. 软打分 ====================
        List<ScoredOffer> scored = new ArrayList<>();
        for (int i = 0; i < offers.size(); i++) {
            ScorableOffer offer = offers.get(i);
            List<String> reasons = reasonsByOffer.get(i);
            ScoreBreakdown breakdown = ScoreBreakdown.builder()
                    .priceScore(priceScore(offer.getPrice(), minPrice, maxPrice))
                    .trustScore(trustOf(offer, providers))
                    .timeWindowFitScore(timeWindowFit(offer.getTimeWindow(),
                            criteria == null ? null : criteria.getRequestedTimeWindow()))
                    .build();
            double score = config.getPriceWeight() * breakdown.getPriceScore()
                    + config.getTrustWeight() * breakdown.getTrustScore()
                    + config.getTimeWindowFitWeight() * breakdown.getTimeWindowFitScore();
            scored.add(ScoredOffer.builder()
                    .offer(offer)
                    .score(score)
                    .breakdown(breakdown)
                    .matchesFilters(reasons.isEmpty())
                    .filterReasons(reasons)
                    .build());
        }

        // ==================== 4. 排序 ====================
        scored.sort(Comparator.comparing(ScoredOffer::isMatchesFilters).reversed()
                .thenComparing(Comparator.comparingDouble(ScoredOffer::getScore).reversed())
                .thenComparing(Comparator.comparingDouble((ScoredOffer s) -> s.getBreakdown().getTrustScore()).reversed())
                .thenComparing(s -> s.getOffer().getOfferId(), Comparator.nullsLast(Comparator.naturalOrder())));

        int eligibleCount = surviving.size();
        return MatchingResult.builder()
                .allOffers(scored)
                .eligibleCount(eligibleCount)
                .selectedOffer(eligibleCount > 0 ? scored.get(0) : null)
                .build();
    }

    /**
     * 反向归一化价格：最便宜为1.0，所有价格相同时为1.0
     */
    public double priceScore(double price, double minPrice, double maxPrice) {
        if (maxPrice <= minPrice) {
            return 1.0;
        }
        double score = (maxPrice - price) / (maxPrice - minPrice);
        return Math.max(0, Math.min(1, score));
    }

    /**
     * 时间契合度：重叠时长 / 请求时长
     * 任一方未给出窗口或请求时长为0时视为完全契合
     */
    public double timeWindowFit(TimeWindow offerWindow, TimeWindow requestedWindow) {
        if (offerWindow == null || requestedWindow == null
                || !offerWindow.isBounded() || !requestedWindow.isBounded()) {
            return 1.0;
        }
        long requestedSeconds = requestedWindow.durationSeconds();
        if (requestedSeconds == 0) {
            return 1.0;
        }
        double fit = (double) offerWindow.overlapSeconds(requestedWindow) / requestedSeconds;
        return Math.max(0, Math.min(1, fit));
    }

    private List<String> filterReasons(ScorableOffer offer, Map<String, Provider> providers, MatchingCriteria criteria) {
        List<String> reasons = new ArrayList<>();
        if (criteria != null && criteria.getRequestedTimeWindow() != null
                && offer.getTimeWindow() != null
                && !offer.getTimeWindow().overlaps(criteria.getRequestedTimeWindow())) {
            reasons.add(REASON_TIME_WINDOW);
        }
        if (offer.getAvailableBlocks() < 1) {
            reasons.add(REASON_NO_AVAILABILITY);
        }
        if (criteria != null && criteria.getMaxPrice() != null && offer.getPrice() > criteria.getMaxPrice()) {
            reasons.add(REASON_PRICE);
        }
        if (trustOf(offer, providers) < config.getMinTrustThreshold()) {
            reasons.add(REASON_TRUST);
        }
        return reasons;
    }

    private double trustOf(ScorableOffer offer, Map<String, Provider> providers) {
        Provider provider = providers == null ? null : providers.get(offer.getProviderId());
        if (provider == null || provider.getTrustScore() == null) {
            return config.getDefaultTrustScore();
        }
        return provider.getTrustScore();
    }
}
