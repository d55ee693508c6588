package org.energytrade.exception;

/**
 * 回调投递失败，只记录不重试
 */
public class UpstreamDeliveryException extends TradeException {

    public UpstreamDeliveryException(String message, Throwable cause) {
        super(ErrorCode.CALLBACK_DELIVERY_FAILED, message, cause);
    }

    public UpstreamDeliveryException(String message) {
        super(ErrorCode.CALLBACK_DELIVERY_FAILED, message);
    }
}
