package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.energytrade.engine.TimeWindow;

import java.util.ArrayList;
import java.util.List;

/**
 * 目录快照：卖方 → 商品 → 报价
 * 报价的 maxQuantity 为实时AVAILABLE区块数
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogView {

    @Builder.Default
    private List<ProviderEntry> providers = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ProviderEntry {
        private String id;
        private String name;
        private Double trustScore;
        @Builder.Default
        private List<ItemEntry> items = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class ItemEntry {
        private String id;
        private String sourceType;
        private Double availableQty;
        private String meterId;
        private List<TimeWindow> productionWindows;
        @Builder.Default
        private List<OfferEntry> offers = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class OfferEntry {
        private String id;
        private String itemId;
        private String providerId;
        private double price;
        private String currency;
        private int maxQuantity;
        private TimeWindow timeWindow;
        private String pricingModel;
        private String settlementType;
    }
}
