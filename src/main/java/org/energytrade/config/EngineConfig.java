package org.energytrade.config;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.engine.FilterExpressionParser;
import org.energytrade.engine.MatchingConfig;
import org.energytrade.engine.MatchingEngine;
import org.energytrade.engine.TrustConfig;
import org.energytrade.engine.TrustEngine;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 纯函数引擎装配
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TradeProperties.class)
public class EngineConfig {

    @Bean
    public TrustEngine trustEngine(TradeProperties properties) {
        TradeProperties.Trust trust = properties.getTrust();
        return new TrustEngine(TrustConfig.builder()
                .defaultScore(trust.getDefaultScore())
                .defaultLimit(trust.getDefaultLimit())
                .successBonus(trust.getSuccessBonus())
                .failurePenalty(trust.getFailurePenalty())
                .cancelPenalty(trust.getCancelPenalty())
                .sellerCancelPenalty(trust.getSellerCancelPenalty())
                .build());
    }

    @Bean
    public MatchingEngine matchingEngine(TradeProperties properties) {
        TradeProperties.Matching matching = properties.getMatching();
        MatchingConfig config = MatchingConfig.builder()
                .priceWeight(matching.getPriceWeight())
                .trustWeight(matching.getTrustWeight())
                .timeWindowFitWeight(matching.getTimeWindowFitWeight())
                .minTrustThreshold(matching.getMinTrustThreshold())
                .defaultTrustScore(matching.getDefaultTrustScore())
                .build();
        if (Math.abs(config.weightSum() - 1.0) > 1e-6) {
            log.warn("[匹配权重配置异常] 权重之和不为1，weightSum={}", config.weightSum());
        }
        return new MatchingEngine(config);
    }

    @Bean
    public FilterExpressionParser filterExpressionParser() {
        return new FilterExpressionParser();
    }
}
