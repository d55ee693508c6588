package org.energytrade.business;

import lombok.AllArgsConstructor;
import lombok.Data;
import org.energytrade.domain.TradeOrder;

import java.util.List;

@Data
@AllArgsConstructor
public class ConfirmedOrder {
    private TradeOrder order;
    private List<String> blockIds;
}
