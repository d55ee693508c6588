package org.energytrade.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.energytrade.domain.EventDirection;
import org.energytrade.domain.TradeEvent;

import java.util.List;

/**
 * 协议消息日志与入站去重
 */
public interface IEventService extends IService<TradeEvent> {

    /**
     * 入站消息是否已处理过
     * 先查缓存，未命中再查数据库，数据库命中时回填缓存
     * 只看INBOUND方向，出站记录不参与判断
     */
    boolean isDuplicateInbound(String messageId);

    /**
     * 记录入站消息
     *
     * @throws org.energytrade.exception.DuplicateMessageException 并发写入同一消息时
     */
    TradeEvent recordInbound(String transactionId, String messageId, String action, String rawJson);

    /**
     * 撤销入站记录（删除事件并清除去重缓存），受理未完成时使用
     */
    void discardInbound(String messageId);

    TradeEvent recordOutbound(String transactionId, String messageId, String action, String rawJson);

    List<TradeEvent> listByTransaction(String transactionId, EventDirection direction);
}
