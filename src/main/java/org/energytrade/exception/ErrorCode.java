package org.energytrade.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码
 */
@Getter
public enum ErrorCode {

    INVALID_REQUEST("40001", HttpStatus.BAD_REQUEST),
    INSUFFICIENT_FUNDS("40201", HttpStatus.PAYMENT_REQUIRED),
    TRADE_LIMIT_EXCEEDED("40301", HttpStatus.FORBIDDEN),
    OFFER_NOT_FOUND("40401", HttpStatus.NOT_FOUND),
    ITEM_NOT_FOUND("40402", HttpStatus.NOT_FOUND),
    ORDER_NOT_FOUND("40403", HttpStatus.NOT_FOUND),
    PROVIDER_NOT_FOUND("40404", HttpStatus.NOT_FOUND),
    PARTICIPANT_NOT_FOUND("40405", HttpStatus.NOT_FOUND),
    INSUFFICIENT_QUANTITY("40901", HttpStatus.CONFLICT),
    CLAIM_CONFLICT("40902", HttpStatus.CONFLICT),
    INVALID_TRANSITION("40903", HttpStatus.CONFLICT),
    IDEMPOTENCY_CONFLICT("40904", HttpStatus.CONFLICT),
    OFFER_IN_USE("40905", HttpStatus.CONFLICT),
    INTERNAL_ERROR("50001", HttpStatus.INTERNAL_SERVER_ERROR),
    CALLBACK_DELIVERY_FAILED("50201", HttpStatus.BAD_GATEWAY);

    private final String code;
    private final HttpStatus httpStatus;

    ErrorCode(String code, HttpStatus httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    /**
     * 按错误码字符串反查，未知错误码返回 INTERNAL_ERROR
     */
    public static ErrorCode ofCode(String code) {
        for (ErrorCode errorCode : values()) {
            if (errorCode.code.equals(code)) {
                return errorCode;
            }
        }
        return INTERNAL_ERROR;
    }
}
