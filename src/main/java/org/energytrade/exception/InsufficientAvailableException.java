package org.energytrade.exception;

import lombok.Getter;

/**
 * 可用区块不足
 */
@Getter
public class InsufficientAvailableException extends TradeException {

    private final String offerId;
    private final int requested;
    private final int available;

    public InsufficientAvailableException(String offerId, int requested, int available) {
        super(ErrorCode.INSUFFICIENT_QUANTITY,
                "Insufficient available blocks for offer " + offerId
                        + ": requested " + requested + ", available " + available);
        this.offerId = offerId;
        this.requested = requested;
        this.available = available;
    }
}
