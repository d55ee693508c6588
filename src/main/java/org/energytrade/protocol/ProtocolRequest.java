package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 入站协议消息 {context, message}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProtocolRequest<T> {
    private ProtocolContext context;
    private T message;
}
