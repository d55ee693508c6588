package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 买方发起的取消
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CancelMessage {
    private String orderId;
    private String buyerId;
    private String reason;
}
