package org.energytrade.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 目录过滤条件，字段为空表示不过滤
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FilterCriteria {

    private String sourceType;

    private Double minAvailableQuantity;

    private TimeWindow timeWindow;

    @JsonIgnore
    public boolean isEmpty() {
        return sourceType == null && minAvailableQuantity == null && timeWindow == null;
    }
}
