package org.energytrade.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.energytrade.domain.ProtocolState;
import org.energytrade.domain.ProtocolTransaction;

import java.util.List;

/**
 * 协议消息处理状态，异步失败通过它对外可见
 */
public interface IProtocolTransactionService extends IService<ProtocolTransaction> {

    ProtocolTransaction markReceived(String messageId, String transactionId, String action, String callbackUri);

    void updateState(String messageId, ProtocolState state);

    void markFailed(String messageId, String errorCode, String errorMessage);

    List<ProtocolTransaction> listByTransaction(String transactionId);
}
