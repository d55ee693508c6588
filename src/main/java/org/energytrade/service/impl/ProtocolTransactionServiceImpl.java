package org.energytrade.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.ProtocolState;
import org.energytrade.domain.ProtocolTransaction;
import org.energytrade.mapper.ProtocolTransactionMapper;
import org.energytrade.service.IProtocolTransactionService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
public class ProtocolTransactionServiceImpl extends ServiceImpl<ProtocolTransactionMapper, ProtocolTransaction>
        implements IProtocolTransactionService {

    private static final int MAX_ERROR_MESSAGE_LENGTH = 500;

    @Override
    public ProtocolTransaction markReceived(String messageId, String transactionId, String action, String callbackUri) {
        LocalDateTime now = LocalDateTime.now();
        ProtocolTransaction existing = getById(messageId);
        if (existing != null) {
            // 上次受理失败的同一消息重新受理
            lambdaUpdate()
                    .eq(ProtocolTransaction::getMessageId, messageId)
                    .set(ProtocolTransaction::getState, ProtocolState.RECEIVED)
                    .set(ProtocolTransaction::getErrorCode, null)
                    .set(ProtocolTransaction::getErrorMessage, null)
                    .set(ProtocolTransaction::getCallbackUri, callbackUri)
                    .set(ProtocolTransaction::getUpdateTime, now)
                    .update();
            log.info("[协议消息重新受理] messageId={}, previousState={}, traceId={}",
                    messageId, existing.getState(), TraceIdUtil.getTraceId());
            existing.setState(ProtocolState.RECEIVED);
            existing.setErrorCode(null);
            existing.setErrorMessage(null);
            existing.setCallbackUri(callbackUri);
            existing.setUpdateTime(now);
            return existing;
        }
        ProtocolTransaction record = ProtocolTransaction.builder()
                .messageId(messageId)
                .transactionId(transactionId)
                .action(action)
                .state(ProtocolState.RECEIVED)
                .callbackUri(callbackUri)
                .createTime(now)
                .updateTime(now)
                .build();
        save(record);
        return record;
    }

    @Override
    public void updateState(String messageId, ProtocolState state) {
        lambdaUpdate()
                .eq(ProtocolTransaction::getMessageId, messageId)
                .set(ProtocolTransaction::getState, state)
                .set(ProtocolTransaction::getUpdateTime, LocalDateTime.now())
                .update();
        log.debug("[协议状态] messageId={}, state={}", messageId, state);
    }

    @Override
    public void markFailed(String messageId, String errorCode, String errorMessage) {
        String message = errorMessage;
        if (message != null && message.length() > MAX_ERROR_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_ERROR_MESSAGE_LENGTH);
        }
        lambdaUpdate()
                .eq(ProtocolTransaction::getMessageId, messageId)
                .set(ProtocolTransaction::getState, ProtocolState.FAILED)
                .set(ProtocolTransaction::getErrorCode, errorCode)
                .set(ProtocolTransaction::getErrorMessage, message)
                .set(ProtocolTransaction::getUpdateTime, LocalDateTime.now())
                .update();
        log.warn("[协议处理失败] messageId={}, errorCode={}, errorMsg={}, traceId={}",
                messageId, errorCode, message, TraceIdUtil.getTraceId());
    }

    @Override
    public List<ProtocolTransaction> listByTransaction(String transactionId) {
        return lambdaQuery()
                .eq(ProtocolTransaction::getTransactionId, transactionId)
                .orderByAsc(ProtocolTransaction::getCreateTime)
                .list();
    }
}
