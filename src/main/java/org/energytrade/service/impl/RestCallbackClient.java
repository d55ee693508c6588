package org.energytrade.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.exception.UpstreamDeliveryException;
import org.energytrade.protocol.CallbackEnvelope;
import org.energytrade.service.ICallbackClient;
import org.energytrade.util.TraceIdUtil;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 基于 RestTemplate 的回调投递
 * 失败只抛出 UpstreamDeliveryException，不在这里重试
 */
@Slf4j
@Service
public class RestCallbackClient implements ICallbackClient {

    public static final String TRACE_HEADER = "X-Trace-Id";

    private final RestTemplate restTemplate;

    public RestCallbackClient(@Qualifier("callbackRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(String baseUri, CallbackEnvelope envelope) {
        if (baseUri == null || baseUri.isBlank()) {
            throw new UpstreamDeliveryException("No callback uri for action " + envelope.getContext().getAction());
        }
        String url = stripTrailingSlash(baseUri) + "/callbacks/" + envelope.getContext().getAction();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (TraceIdUtil.getTraceId() != null) {
            headers.set(TRACE_HEADER, TraceIdUtil.getTraceId());
        }
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, new HttpEntity<>(envelope, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new UpstreamDeliveryException("Callback " + url + " returned " + response.getStatusCode().value());
            }
            log.info("[回调投递成功] url={}, transactionId={}, messageId={}, traceId={}",
                    url, envelope.getContext().getTransactionId(), envelope.getContext().getMessageId(),
                    TraceIdUtil.getTraceId());
        } catch (RestClientException e) {
            throw new UpstreamDeliveryException("Callback " + url + " failed: " + e.getMessage(), e);
        }
    }

    static String stripTrailingSlash(String uri) {
        return uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
    }
}
