package org.energytrade.protocol;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 协议上下文
 * 回调地址优先取 callback_uri，缺失时取 bap_uri
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ProtocolContext {
    private String domain;
    private String action;
    private String version;
    private String bapId;
    private String bapUri;
    private String bppId;
    private String bppUri;
    private String callbackUri;
    private String transactionId;
    private String messageId;
    private String timestamp;
    private String ttl;

    public String resolveCallbackUri() {
        if (callbackUri != null && !callbackUri.isBlank()) {
            return callbackUri;
        }
        return bapUri;
    }
}
