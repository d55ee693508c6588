package org.energytrade.exception;

/**
 * 请求字段缺失或非法，同步返回，不重试
 */
public class ValidationException extends TradeException {

    public ValidationException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
