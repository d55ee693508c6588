package org.energytrade.exception;

/**
 * 同一幂等键的请求仍在处理中
 */
public class IdempotencyConflictException extends ConflictException {

    public IdempotencyConflictException(String endpoint, String key) {
        super(ErrorCode.IDEMPOTENCY_CONFLICT,
                "Request with idempotency key " + key + " on " + endpoint + " is still in progress");
    }
}
