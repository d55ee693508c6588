package org.energytrade.service;

import org.energytrade.protocol.CallbackEnvelope;

/**
 * 出站回调投递
 */
public interface ICallbackClient {

    /**
     * POST {baseUri}/callbacks/{envelope.context.action}
     *
     * @throws org.energytrade.exception.UpstreamDeliveryException 对方不可达或返回非2xx
     */
    void send(String baseUri, CallbackEnvelope envelope);
}
