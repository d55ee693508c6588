package org.energytrade.exception;

import lombok.Getter;

/**
 * 非法状态流转，携带当前状态与目标状态
 */
@Getter
public class InvalidTransitionException extends TradeException {

    private final String currentState;
    private final String attemptedState;

    public InvalidTransitionException(String entity, String entityId, Enum<?> currentState, Enum<?> attemptedState) {
        super(ErrorCode.INVALID_TRANSITION,
                "Invalid " + entity + " transition for " + entityId + ": " + currentState + " -> " + attemptedState);
        this.currentState = String.valueOf(currentState);
        this.attemptedState = String.valueOf(attemptedState);
    }
}
