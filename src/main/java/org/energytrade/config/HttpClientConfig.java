package org.energytrade.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * 回调投递用的HTTP客户端
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate callbackRestTemplate(RestTemplateBuilder builder, TradeProperties properties) {
        TradeProperties.Protocol protocol = properties.getProtocol();
        return builder
                .setConnectTimeout(Duration.ofMillis(protocol.getCallbackConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(protocol.getCallbackReadTimeoutMs()))
                .build();
    }
}
