package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.energytrade.engine.TimeWindow;

/**
 * discover 消息体
 * filters.expression 优先，缺失的条件由 intent 补齐
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DiscoverMessage {

    private Intent intent;
    private Filters filters;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Intent {
        private String sourceType;
        private Integer quantity;
        private TimeWindow timeWindow;
        private Double maxPrice;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Filters {
        private String expression;
    }
}
