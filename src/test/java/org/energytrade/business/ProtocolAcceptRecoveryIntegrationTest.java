package org.energytrade.business;

import org.energytrade.domain.EventDirection;
import org.energytrade.domain.Offer;
import org.energytrade.domain.ProtocolState;
import org.energytrade.domain.ProtocolTransaction;
import org.energytrade.exception.ErrorCode;
import org.energytrade.protocol.AckResponse;
import org.energytrade.protocol.CallbackEnvelope;
import org.energytrade.protocol.DiscoverMessage;
import org.energytrade.protocol.DiscoverPayload;
import org.energytrade.protocol.ProtocolContext;
import org.energytrade.protocol.ProtocolRequest;
import org.energytrade.service.IEventService;
import org.energytrade.service.IProtocolTransactionService;
import org.energytrade.support.IntegrationTestSupport;
import org.energytrade.task.ProtocolTaskDispatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.mockito.invocation.Invocation;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.core.task.TaskRejectedException;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doCallRealMethod;

/**
 * 受理中途失败后，同一消息重发必须被重新处理
 */
class ProtocolAcceptRecoveryIntegrationTest extends IntegrationTestSupport {

    private static final long CALLBACK_TIMEOUT_MS = 10_000;

    @SpyBean
    private ProtocolTaskDispatcher taskDispatcher;

    @Autowired
    private TransactionProtocolService protocolService;

    @Autowired
    private IEventService eventService;

    @Autowired
    private IProtocolTransactionService protocolTransactionService;

    @Test
    @DisplayName("任务提交被拒：NACK且状态FAILED，重发后正常回调")
    void rejectedDispatchIsRetriedOnRedelivery() throws InterruptedException {
        Offer offer = seedOffer(10, 3.0);
        String transactionId = randomId("txn");
        ProtocolContext context = ProtocolContext.builder()
                .domain("energy-trade")
                .version("1.0.0")
                .bapId("bap.test")
                .bapUri("http://bap.test")
                .transactionId(transactionId)
                .messageId(UUID.randomUUID().toString())
                .build();
        Mockito.doThrow(new TaskRejectedException("protocol pool saturated"))
                .when(taskDispatcher).dispatch(any(), any());

        AckResponse first = protocolService.discover(discoverRequest(context));

        assertThat(first.isAck()).isFalse();
        assertThat(first.getError().getCode()).isEqualTo(ErrorCode.INTERNAL_ERROR.getCode());
        assertThat(eventService.listByTransaction(transactionId, EventDirection.INBOUND)).isEmpty();
        List<ProtocolTransaction> rows = protocolTransactionService.listByTransaction(transactionId);
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getState()).isEqualTo(ProtocolState.FAILED);

        doCallRealMethod().when(taskDispatcher).dispatch(any(), any());
        AckResponse retry = protocolService.discover(discoverRequest(context.toBuilder().build()));

        assertThat(retry.isAck()).isTrue();
        CallbackEnvelope callback = awaitCallback(transactionId, "on_discover");
        assertThat(callback.getError()).isNull();
        assertThat(((DiscoverPayload) callback.getMessage()).getRankedOffers())
                .anySatisfy(scored -> assertThat(scored.getOffer().getOfferId()).isEqualTo(offer.getId()));
        assertThat(eventService.listByTransaction(transactionId, EventDirection.INBOUND)).hasSize(1);
    }

    private static ProtocolRequest<DiscoverMessage> discoverRequest(ProtocolContext context) {
        return ProtocolRequest.<DiscoverMessage>builder()
                .context(context)
                .message(DiscoverMessage.builder()
                        .intent(DiscoverMessage.Intent.builder().quantity(1).build())
                        .build())
                .build();
    }

    private CallbackEnvelope awaitCallback(String transactionId, String callbackAction) throws InterruptedException {
        long deadline = System.currentTimeMillis() + CALLBACK_TIMEOUT_MS;
        while (System.currentTimeMillis() < deadline) {
            for (Invocation invocation : Mockito.mockingDetails(callbackClient).getInvocations()) {
                CallbackEnvelope envelope = invocation.getArgument(1);
                if (transactionId.equals(envelope.getContext().getTransactionId())
                        && callbackAction.equals(envelope.getContext().getAction())) {
                    return envelope;
                }
            }
            Thread.sleep(50);
        }
        throw new AssertionError("No " + callbackAction + " callback for " + transactionId);
    }
}
