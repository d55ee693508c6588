package org.energytrade.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 出站回调 on_{action}
 * 处理失败时 message 为空，error 携带错误码
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallbackEnvelope {
    private ProtocolContext context;
    private Object message;
    private ProtocolError error;
}
