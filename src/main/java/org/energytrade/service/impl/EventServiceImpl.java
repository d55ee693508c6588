package org.energytrade.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.cache.IKeyValueCache;
import org.energytrade.config.TradeProperties;
import org.energytrade.domain.EventDirection;
import org.energytrade.domain.TradeEvent;
import org.energytrade.exception.DuplicateMessageException;
import org.energytrade.mapper.TradeEventMapper;
import org.energytrade.service.IEventService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 协议消息日志实现
 *
 * 去重分两层：
 * 1. 缓存：key = dedup:INBOUND:{messageId}，带TTL
 * 2. 数据库：events 表 (message_id, direction) 唯一约束，缓存未命中时兜底并回填
 */
@Slf4j
@Service
public class EventServiceImpl extends ServiceImpl<TradeEventMapper, TradeEvent> implements IEventService {

    private static final String DEDUP_KEY_PREFIX = "dedup:" + EventDirection.INBOUND.name() + ":";

    private final TradeEventMapper tradeEventMapper;
    private final IKeyValueCache cache;
    private final TradeProperties properties;

    public EventServiceImpl(TradeEventMapper tradeEventMapper, IKeyValueCache cache, TradeProperties properties) {
        this.tradeEventMapper = tradeEventMapper;
        this.cache = cache;
        this.properties = properties;
    }

    @Override
    public boolean isDuplicateInbound(String messageId) {
        String key = DEDUP_KEY_PREFIX + messageId;

        // ==================== 1. 缓存 ====================
        if (cache.get(key) != null) {
            log.info("[消息去重-缓存命中] messageId={}, traceId={}", messageId, TraceIdUtil.getTraceId());
            return true;
        }

        // ==================== 2. 数据库兜底 ====================
        long count = tradeEventMapper.countByMessageIdAndDirection(messageId, EventDirection.INBOUND.name());
        if (count > 0) {
            markProcessed(messageId);
            log.info("[消息去重-数据库命中] messageId={}, 已回填缓存, traceId={}", messageId, TraceIdUtil.getTraceId());
            return true;
        }
        return false;
    }

    @Override
    public TradeEvent recordInbound(String transactionId, String messageId, String action, String rawJson) {
        TradeEvent event = buildEvent(transactionId, messageId, action, EventDirection.INBOUND, rawJson);
        try {
            save(event);
        } catch (DuplicateKeyException e) {
            // 并发的同一消息被唯一约束拦下
            markProcessed(messageId);
            throw new DuplicateMessageException(messageId);
        }
        markProcessed(messageId);
        log.info("[入站消息记录] transactionId={}, messageId={}, action={}, traceId={}",
                transactionId, messageId, action, TraceIdUtil.getTraceId());
        return event;
    }

    @Override
    public void discardInbound(String messageId) {
        lambdaUpdate()
                .eq(TradeEvent::getMessageId, messageId)
                .eq(TradeEvent::getDirection, EventDirection.INBOUND)
                .remove();
        cache.delete(DEDUP_KEY_PREFIX + messageId);
        log.warn("[入站消息撤销] messageId={}, traceId={}", messageId, TraceIdUtil.getTraceId());
    }

    @Override
    public TradeEvent recordOutbound(String transactionId, String messageId, String action, String rawJson) {
        TradeEvent event = buildEvent(transactionId, messageId, action, EventDirection.OUTBOUND, rawJson);
        save(event);
        log.info("[出站消息记录] transactionId={}, messageId={}, action={}, traceId={}",
                transactionId, messageId, action, TraceIdUtil.getTraceId());
        return event;
    }

    @Override
    public List<TradeEvent> listByTransaction(String transactionId, EventDirection direction) {
        return lambdaQuery()
                .eq(TradeEvent::getTransactionId, transactionId)
                .eq(direction != null, TradeEvent::getDirection, direction)
                .orderByAsc(TradeEvent::getId)
                .list();
    }

    private void markProcessed(String messageId) {
        cache.set(DEDUP_KEY_PREFIX + messageId, String.valueOf(System.currentTimeMillis()),
                Duration.ofSeconds(properties.getDedup().getTtlSeconds()));
    }

    private TradeEvent buildEvent(String transactionId, String messageId, String action,
                                  EventDirection direction, String rawJson) {
        return TradeEvent.builder()
                .transactionId(transactionId)
                .messageId(messageId)
                .action(action)
                .direction(direction)
                .rawJson(rawJson)
                .createTime(LocalDateTime.now())
                .build();
    }
}
