package org.energytrade.exception;

import lombok.Getter;

/**
 * 重复消息，协议层直接返回ACK
 */
@Getter
public class DuplicateMessageException extends TradeException {

    private final String messageId;

    public DuplicateMessageException(String messageId) {
        super(ErrorCode.INVALID_REQUEST, "Duplicate message " + messageId);
        this.messageId = messageId;
    }
}
