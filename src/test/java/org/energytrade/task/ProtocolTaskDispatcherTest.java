package org.energytrade.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.energytrade.config.TradeProperties;
import org.energytrade.domain.ProtocolState;
import org.energytrade.exception.ErrorCode;
import org.energytrade.exception.InsufficientAvailableException;
import org.energytrade.exception.UpstreamDeliveryException;
import org.energytrade.protocol.CallbackEnvelope;
import org.energytrade.protocol.ProtocolContext;
import org.energytrade.service.ICallbackClient;
import org.energytrade.service.IEventService;
import org.energytrade.service.IProtocolTransactionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 异步任务错误边界：业务失败、回调失败都落到 protocol_transactions
 */
@ExtendWith(MockitoExtension.class)
class ProtocolTaskDispatcherTest {

    @Mock
    private ThreadPoolTaskScheduler scheduler;
    @Mock
    private ICallbackClient callbackClient;
    @Mock
    private IEventService eventService;
    @Mock
    private IProtocolTransactionService protocolTransactionService;

    private ProtocolTaskDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        dispatcher = new ProtocolTaskDispatcher(scheduler, callbackClient, eventService,
                protocolTransactionService, new ObjectMapper(), new TradeProperties());
    }

    private static ProtocolContext inbound() {
        return ProtocolContext.builder()
                .action("select")
                .transactionId("txn-1")
                .messageId("msg-1")
                .bapUri("http://bap.example")
                .build();
    }

    @Test
    @DisplayName("回调上下文：on_前缀、新消息ID、同一事务")
    void callbackContextDerivedFromInbound() {
        ProtocolContext callback = dispatcher.callbackContext(inbound());

        assertThat(callback.getAction()).isEqualTo("on_select");
        assertThat(callback.getTransactionId()).isEqualTo("txn-1");
        assertThat(callback.getMessageId()).isNotEqualTo("msg-1");
        assertThat(callback.getTimestamp()).isNotBlank();
        assertThat(callback.getBppId()).isEqualTo(new TradeProperties().getProtocol().getBppId());
        assertThat(callback.getBapUri()).isEqualTo("http://bap.example");
    }

    @Test
    @DisplayName("处理成功：记录出站事件，投递回调，状态 CALLBACK_SENT")
    void successfulTaskSendsCallback() {
        dispatcher.runTask(inbound(), () -> Map.of("ok", true));

        ArgumentCaptor<CallbackEnvelope> envelope = ArgumentCaptor.forClass(CallbackEnvelope.class);
        verify(callbackClient).send(eq("http://bap.example"), envelope.capture());
        assertThat(envelope.getValue().getError()).isNull();
        assertThat(envelope.getValue().getMessage()).isEqualTo(Map.of("ok", true));
        verify(eventService).recordOutbound(eq("txn-1"), anyString(), eq("on_select"), anyString());
        verify(protocolTransactionService).updateState("msg-1", ProtocolState.PROCESSING);
        verify(protocolTransactionService).updateState("msg-1", ProtocolState.CALLBACK_SENT);
        verify(protocolTransactionService, never()).markFailed(anyString(), anyString(), anyString());
    }

    @Test
    @DisplayName("业务失败：投递错误回调并标记 FAILED")
    void businessFailureSendsErrorCallback() {
        dispatcher.runTask(inbound(), () -> {
            throw new InsufficientAvailableException("offer-1", 10, 3);
        });

        ArgumentCaptor<CallbackEnvelope> envelope = ArgumentCaptor.forClass(CallbackEnvelope.class);
        verify(callbackClient).send(anyString(), envelope.capture());
        assertThat(envelope.getValue().getMessage()).isNull();
        assertThat(envelope.getValue().getError().getCode()).isEqualTo(ErrorCode.INSUFFICIENT_QUANTITY.getCode());
        verify(protocolTransactionService).markFailed(eq("msg-1"),
                eq(ErrorCode.INSUFFICIENT_QUANTITY.getCode()), anyString());
        verify(protocolTransactionService, never()).updateState("msg-1", ProtocolState.CALLBACK_SENT);
    }

    @Test
    @DisplayName("未知异常：错误码 INTERNAL_ERROR")
    void unexpectedFailureMapsToInternalError() {
        dispatcher.runTask(inbound(), () -> {
            throw new IllegalStateException("boom");
        });

        verify(protocolTransactionService).markFailed(eq("msg-1"),
                eq(ErrorCode.INTERNAL_ERROR.getCode()), anyString());
    }

    @Test
    @DisplayName("回调投递失败：标记 CALLBACK_DELIVERY_FAILED，不抛出")
    void deliveryFailureIsRecorded() {
        doThrow(new UpstreamDeliveryException("connection refused"))
                .when(callbackClient).send(anyString(), any(CallbackEnvelope.class));

        dispatcher.runTask(inbound(), () -> Map.of("ok", true));

        verify(protocolTransactionService).markFailed(eq("msg-1"),
                eq(ErrorCode.CALLBACK_DELIVERY_FAILED.getCode()), anyString());
        verify(protocolTransactionService, never()).updateState("msg-1", ProtocolState.CALLBACK_SENT);
    }

    @Test
    @DisplayName("无延迟时直接提交执行")
    void dispatchWithoutDelayExecutesImmediately() {
        TradeProperties properties = new TradeProperties();
        properties.getProtocol().setCallbackDelayMs(0);
        ProtocolTaskDispatcher immediate = new ProtocolTaskDispatcher(scheduler, callbackClient, eventService,
                protocolTransactionService, new ObjectMapper(), properties);

        immediate.dispatch(inbound(), () -> Map.of());

        verify(scheduler).execute(any(Runnable.class));
    }
}
