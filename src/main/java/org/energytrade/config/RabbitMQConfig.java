package org.energytrade.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类
 * - 交付核验事件的Exchange、Queue、Binding
 * - 消费失败的消息进入死信队列，延迟后回到主队列重试
 * - 仅在 spring.rabbitmq.listener.simple.enabled=true 时启用
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "spring.rabbitmq.listener.simple.enabled", havingValue = "true", matchIfMissing = false)
public class RabbitMQConfig {

    // ==================== 交付核验相关 ====================

    public static final String DELIVERY_VERIFICATION_EXCHANGE = "delivery.verification.exchange";
    public static final String DELIVERY_VERIFICATION_QUEUE = "delivery.verification.queue";
    public static final String DELIVERY_VERIFICATION_ROUTING_KEY = "delivery.verification";

    // 死信交换机（用于重试）
    public static final String DELIVERY_VERIFICATION_DLX_EXCHANGE = "delivery.verification.dlx.exchange";
    public static final String DELIVERY_VERIFICATION_DLX_QUEUE = "delivery.verification.dlx.queue";
    public static final String DELIVERY_VERIFICATION_DLX_ROUTING_KEY = "delivery.verification.dlx";

    // ==================== 主队列配置 ====================

    @Bean
    public DirectExchange deliveryVerificationExchange() {
        return new DirectExchange(DELIVERY_VERIFICATION_EXCHANGE, true, false);
    }

    @Bean
    public Queue deliveryVerificationQueue() {
        return QueueBuilder.durable(DELIVERY_VERIFICATION_QUEUE)
                .deadLetterExchange(DELIVERY_VERIFICATION_DLX_EXCHANGE)
                .deadLetterRoutingKey(DELIVERY_VERIFICATION_DLX_ROUTING_KEY)
                .build();
    }

    @Bean
    public Binding deliveryVerificationBinding(Queue deliveryVerificationQueue,
                                               DirectExchange deliveryVerificationExchange) {
        return BindingBuilder.bind(deliveryVerificationQueue)
                .to(deliveryVerificationExchange)
                .with(DELIVERY_VERIFICATION_ROUTING_KEY);
    }

    // ==================== 死信队列配置（重试队列） ====================

    @Bean
    public DirectExchange deliveryVerificationDlxExchange() {
        return new DirectExchange(DELIVERY_VERIFICATION_DLX_EXCHANGE, true, false);
    }

    @Bean
    public Queue deliveryVerificationDlxQueue() {
        return QueueBuilder.durable(DELIVERY_VERIFICATION_DLX_QUEUE)
                // 重试延迟：30秒后回到主队列
                .deadLetterExchange(DELIVERY_VERIFICATION_EXCHANGE)
                .deadLetterRoutingKey(DELIVERY_VERIFICATION_ROUTING_KEY)
                .ttl(30000)
                .build();
    }

    @Bean
    public Binding deliveryVerificationDlxBinding(Queue deliveryVerificationDlxQueue,
                                                  DirectExchange deliveryVerificationDlxExchange) {
        return BindingBuilder.bind(deliveryVerificationDlxQueue)
                .to(deliveryVerificationDlxExchange)
                .with(DELIVERY_VERIFICATION_DLX_ROUTING_KEY);
    }

    // ==================== RabbitTemplate 配置 ====================

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("[消息发送失败] correlationData={}, cause={}", correlationData, cause);
            }
        });
        return rabbitTemplate;
    }
}
