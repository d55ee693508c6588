package org.energytrade.domain;

/**
 * 协议消息处理状态
 * RECEIVED → ACKED → PROCESSING → CALLBACK_SENT，异步失败进入 FAILED
 */
public enum ProtocolState {
    RECEIVED,
    ACKED,
    PROCESSING,
    CALLBACK_SENT,
    FAILED
}
