package org.energytrade.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 交易引擎配置
 */
@Data
@ConfigurationProperties(prefix = "energy-trade")
public class TradeProperties {

    private Matching matching = new Matching();
    private Trust trust = new Trust();
    private Cancellation cancellation = new Cancellation();
    private Protocol protocol = new Protocol();
    private Ledger ledger = new Ledger();
    private Dedup dedup = new Dedup();
    private Idempotency idempotency = new Idempotency();
    private Cache cache = new Cache();

    @Data
    public static class Matching {
        private double priceWeight = 0.40;
        private double trustWeight = 0.35;
        private double timeWindowFitWeight = 0.25;
        private double minTrustThreshold = 0.2;
        private double defaultTrustScore = 0.5;
    }

    @Data
    public static class Trust {
        private double defaultScore = 0.3;
        private int defaultLimit = 10;
        private double successBonus = 0.02;
        private double failurePenalty = 0.10;
        private double cancelPenalty = 0.03;
        private double sellerCancelPenalty = 0.05;
    }

    @Data
    public static class Cancellation {
        /**
         * 交付开始前多少分钟进入取消窗口
         */
        private long windowMinutes = 30;
        private double buyerPenaltyRate = 0.10;
        /**
         * 买方违约金中补偿给卖方的比例
         */
        private double sellerCompensationShare = 0.5;
        private double sellerPenaltyRate = 0.05;
    }

    @Data
    public static class Protocol {
        private long callbackDelayMs = 100;
        private int callbackConnectTimeoutMs = 3000;
        private int callbackReadTimeoutMs = 5000;
        private int workerPoolSize = 4;
        private String bppId = "energy-trade-bpp";
        private String bppUri = "http://localhost:8080";
    }

    @Data
    public static class Ledger {
        private int claimMaxAttempts = 5;
        private long claimRetryBackoffMs = 20;
    }

    @Data
    public static class Dedup {
        private long ttlSeconds = 86400;
    }

    @Data
    public static class Idempotency {
        private long lockTtlSeconds = 30;
        private long responseTtlSeconds = 86400;
    }

    @Data
    public static class Cache {
        /**
         * redis 或 caffeine
         */
        private String type = "redis";
        private long maximumSize = 100_000;
    }
}
