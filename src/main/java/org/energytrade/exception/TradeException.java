package org.energytrade.exception;

import lombok.Getter;

/**
 * 交易引擎异常基类
 * 在协议处理边界统一转换为NACK或错误响应
 */
@Getter
public class TradeException extends RuntimeException {

    private final ErrorCode errorCode;

    public TradeException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TradeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
