package org.energytrade.business;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.energytrade.domain.CancelParty;

/**
 * 取消的资金与信任后果（只计算金额，不执行结算）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CancellationOutcome {
    private CancelParty cancelledBy;
    /**
     * 是否处于取消窗口内（交付开始前 windowMinutes 分钟起）
     */
    private boolean withinWindow;
    private double buyerPenalty;
    private double sellerCompensation;
    private double sellerPenalty;
    private double buyerRefund;
}
