package org.energytrade.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.energytrade.domain.BlockStats;
import org.energytrade.domain.TradeOrder;

import java.util.List;

/**
 * on_confirm / on_status / on_cancel 回调体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderPayload {
    private TradeOrder order;
    /**
     * PENDING / IN_PROGRESS / COMPLETED / CANCELLED
     */
    private String fulfillmentState;
    private List<String> blockIds;
    private BlockStats blockStats;
}
