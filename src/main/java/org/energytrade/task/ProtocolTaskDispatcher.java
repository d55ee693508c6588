package org.energytrade.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.config.TradeProperties;
import org.energytrade.domain.ProtocolState;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.TradeException;
import org.energytrade.exception.UpstreamDeliveryException;
import org.energytrade.protocol.CallbackEnvelope;
import org.energytrade.protocol.ProtocolContext;
import org.energytrade.protocol.ProtocolError;
import org.energytrade.service.ICallbackClient;
import org.energytrade.service.IEventService;
import org.energytrade.service.IProtocolTransactionService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 协议异步任务分发
 *
 * ACK之后的处理作为独立任务提交到 protocolTaskScheduler：
 * 1. 状态置为 PROCESSING，执行业务处理得到回调体
 * 2. 记录OUTBOUND事件，投递 on_{action} 回调，状态置为 CALLBACK_SENT
 * 3. 业务失败：投递带 error 的回调，状态置为 FAILED
 * 4. 回调投递失败：记录日志，状态置为 FAILED（CALLBACK_DELIVERY_FAILED），不重试
 *
 * 任务内部捕获所有异常，失败结果通过 protocol_transactions 对外可见
 */
@Slf4j
@Component
public class ProtocolTaskDispatcher {

    private static final String CALLBACK_PREFIX = "on_";

    private final ThreadPoolTaskScheduler scheduler;
    private final ICallbackClient callbackClient;
    private final IEventService eventService;
    private final IProtocolTransactionService protocolTransactionService;
    private final ObjectMapper objectMapper;
    private final TradeProperties properties;

    public ProtocolTaskDispatcher(@Qualifier("protocolTaskScheduler") ThreadPoolTaskScheduler scheduler,
                                  ICallbackClient callbackClient,
                                  IEventService eventService,
                                  IProtocolTransactionService protocolTransactionService,
                                  ObjectMapper objectMapper,
                                  TradeProperties properties) {
        this.scheduler = scheduler;
        this.callbackClient = callbackClient;
        this.eventService = eventService;
        this.protocolTransactionService = protocolTransactionService;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * 提交异步处理任务
     *
     * @param context   入站消息上下文
     * @param processor 业务处理，返回回调 message 部分
     */
    public void dispatch(ProtocolContext context, Supplier<Object> processor) {
        Runnable task = TraceIdUtil.wrap(() -> runTask(context, processor));
        long delayMs = properties.getProtocol().getCallbackDelayMs();
        if (delayMs <= 0) {
            scheduler.execute(task);
        } else {
            scheduler.schedule(task, Instant.now().plusMillis(delayMs));
        }
        log.info("[协议任务已提交] action={}, transactionId={}, messageId={}, delayMs={}, traceId={}",
                context.getAction(), context.getTransactionId(), context.getMessageId(), delayMs,
                TraceIdUtil.getTraceId());
    }

    void runTask(ProtocolContext context, Supplier<Object> processor) {
        String messageId = context.getMessageId();
        ProtocolContext callbackContext = callbackContext(context);
        try {
            // ==================== 1. 业务处理 ====================
            protocolTransactionService.updateState(messageId, ProtocolState.PROCESSING);
            Object payload = processor.get();

            // ==================== 2. 投递回调 ====================
            deliver(context, CallbackEnvelope.builder().context(callbackContext).message(payload).build());
            protocolTransactionService.updateState(messageId, ProtocolState.CALLBACK_SENT);
            log.info("[协议处理完成] action={}, transactionId={}, messageId={}, traceId={}",
                    context.getAction(), context.getTransactionId(), messageId, TraceIdUtil.getTraceId());
        } catch (UpstreamDeliveryException e) {
            log.error("[回调投递失败] action={}, transactionId={}, messageId={}, errorMsg={}, traceId={}",
                    context.getAction(), context.getTransactionId(), messageId, e.getMessage(),
                    TraceIdUtil.getTraceId(), e);
            protocolTransactionService.markFailed(messageId, e.getErrorCode().getCode(), e.getMessage());
        } catch (TradeException e) {
            log.warn("[协议处理失败] action={}, transactionId={}, messageId={}, errorCode={}, errorMsg={}, traceId={}",
                    context.getAction(), context.getTransactionId(), messageId, e.getErrorCode().getCode(),
                    e.getMessage(), TraceIdUtil.getTraceId());
            failWithCallback(context, callbackContext, e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("[协议处理异常] action={}, transactionId={}, messageId={}, errorMsg={}, traceId={}",
                    context.getAction(), context.getTransactionId(), messageId, e.getMessage(),
                    TraceIdUtil.getTraceId(), e);
            failWithCallback(context, callbackContext, ErrorCode.INTERNAL_ERROR, "Internal error");
        }
    }

    private void failWithCallback(ProtocolContext context, ProtocolContext callbackContext,
                                  ErrorCode errorCode, String message) {
        try {
            deliver(context, CallbackEnvelope.builder()
                    .context(callbackContext)
                    .error(new ProtocolError(errorCode.getCode(), message))
                    .build());
            protocolTransactionService.markFailed(context.getMessageId(), errorCode.getCode(), message);
        } catch (RuntimeException e) {
            log.error("[错误回调投递失败] action={}, transactionId={}, messageId={}, errorMsg={}, traceId={}",
                    context.getAction(), context.getTransactionId(), context.getMessageId(), e.getMessage(),
                    TraceIdUtil.getTraceId(), e);
            protocolTransactionService.markFailed(context.getMessageId(),
                    ErrorCode.CALLBACK_DELIVERY_FAILED.getCode(), message + "; callback: " + e.getMessage());
        }
    }

    private void deliver(ProtocolContext inbound, CallbackEnvelope envelope) {
        ProtocolContext callbackContext = envelope.getContext();
        eventService.recordOutbound(callbackContext.getTransactionId(), callbackContext.getMessageId(),
                callbackContext.getAction(), toJson(envelope));
        callbackClient.send(inbound.resolveCallbackUri(), envelope);
    }

    /**
     * 回调上下文：复制入站上下文，动作改为 on_{action}，生成新的消息ID和时间戳
     */
    public ProtocolContext callbackContext(ProtocolContext inbound) {
        return inbound.toBuilder()
                .action(CALLBACK_PREFIX + inbound.getAction())
                .messageId(UUID.randomUUID().toString())
                .timestamp(OffsetDateTime.now(ZoneOffset.UTC).toString())
                .bppId(inbound.getBppId() != null ? inbound.getBppId() : properties.getProtocol().getBppId())
                .bppUri(inbound.getBppUri() != null ? inbound.getBppUri() : properties.getProtocol().getBppUri())
                .build();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new TradeException(ErrorCode.INTERNAL_ERROR, "Cannot serialize callback", e);
        }
    }
}
