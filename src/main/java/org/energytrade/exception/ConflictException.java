package org.energytrade.exception;

/**
 * 乐观锁版本冲突，内部有限次重试后升级为 {@link InsufficientAvailableException}
 */
public class ConflictException extends TradeException {

    public ConflictException(String message) {
        super(ErrorCode.CLAIM_CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorCode.CLAIM_CONFLICT, message, cause);
    }

    protected ConflictException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
