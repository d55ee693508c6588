package org.energytrade.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.cache.IKeyValueCache;
import org.energytrade.config.TradeProperties;
import org.energytrade.exception.IdempotencyConflictException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 幂等键工具类（面向买卖方HTTP重试，与协议消息去重相互独立）
 * - 处理期间用 SET NX EX 锁住幂等键，并发的同键请求返回冲突
 * - 成功响应缓存下来，同键重试直接返回缓存结果
 * - 处理失败时释放锁，允许调用方重试
 * - 只释放自己持有的锁，超时后被他人获取的锁不受影响
 */
@Slf4j
@Component
public class IdempotencyKeyUtil {

    public static final String REPLAY_HEADER = "X-Idempotency-Replay";

    private static final String RESPONSE_KEY_PREFIX = "idem:";
    private static final String LOCK_KEY_PREFIX = "idem:lock:";

    private final IKeyValueCache cache;
    private final ObjectMapper objectMapper;
    private final TradeProperties properties;

    public IdempotencyKeyUtil(IKeyValueCache cache, ObjectMapper objectMapper, TradeProperties properties) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public ResponseEntity<Map<String, Object>> execute(String endpoint, String idempotencyKey,
                                                       Supplier<ResponseEntity<Map<String, Object>>> action) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return action.get();
        }

        // ==================== 1. 命中缓存直接重放 ====================
        ResponseEntity<Map<String, Object>> replay = findCachedResponse(endpoint, idempotencyKey);
        if (replay != null) {
            return replay;
        }

        // ==================== 2. 加处理锁 ====================
        String lockKey = lockKey(endpoint, idempotencyKey);
        Duration lockTtl = Duration.ofSeconds(properties.getIdempotency().getLockTtlSeconds());
        String owner = UUID.randomUUID() + ":" + (TraceIdUtil.getTraceId() == null ? "anonymous" : TraceIdUtil.getTraceId());
        if (!cache.setIfAbsent(lockKey, owner, lockTtl)) {
            // 锁刚释放且结果已缓存
            replay = findCachedResponse(endpoint, idempotencyKey);
            if (replay != null) {
                return replay;
            }
            log.warn("[幂等键冲突] endpoint={}, idempotencyKey={}, traceId={}",
                    endpoint, idempotencyKey, TraceIdUtil.getTraceId());
            throw new IdempotencyConflictException(endpoint, idempotencyKey);
        }

        // ==================== 3. 执行并缓存成功结果 ====================
        try {
            ResponseEntity<Map<String, Object>> response = action.get();
            if (response.getStatusCode().is2xxSuccessful()) {
                storeResponse(endpoint, idempotencyKey, response);
            }
            return response;
        } finally {
            if (!cache.deleteIfEquals(lockKey, owner)) {
                log.warn("[幂等锁已失效] 处理超过锁TTL，锁已过期或被其他请求持有，endpoint={}, idempotencyKey={}, traceId={}",
                        endpoint, idempotencyKey, TraceIdUtil.getTraceId());
            }
        }
    }

    private ResponseEntity<Map<String, Object>> findCachedResponse(String endpoint, String idempotencyKey) {
        String cached = cache.get(responseKey(endpoint, idempotencyKey));
        if (cached == null) {
            return null;
        }
        try {
            StoredResponse stored = objectMapper.readValue(cached, StoredResponse.class);
            log.info("[幂等重放] endpoint={}, idempotencyKey={}, traceId={}",
                    endpoint, idempotencyKey, TraceIdUtil.getTraceId());
            return ResponseEntity.status(HttpStatus.valueOf(stored.getStatus()))
                    .header(REPLAY_HEADER, "true")
                    .body(stored.getBody());
        } catch (JsonProcessingException e) {
            log.warn("[幂等缓存损坏] endpoint={}, idempotencyKey={}, errorMsg={}",
                    endpoint, idempotencyKey, e.getMessage());
            cache.delete(responseKey(endpoint, idempotencyKey));
            return null;
        }
    }

    private void storeResponse(String endpoint, String idempotencyKey, ResponseEntity<Map<String, Object>> response) {
        try {
            String json = objectMapper.writeValueAsString(
                    new StoredResponse(response.getStatusCode().value(), response.getBody()));
            cache.set(responseKey(endpoint, idempotencyKey), json,
                    Duration.ofSeconds(properties.getIdempotency().getResponseTtlSeconds()));
        } catch (JsonProcessingException e) {
            log.error("[幂等结果缓存失败] endpoint={}, idempotencyKey={}, errorMsg={}",
                    endpoint, idempotencyKey, e.getMessage(), e);
        }
    }

    static String responseKey(String endpoint, String idempotencyKey) {
        return RESPONSE_KEY_PREFIX + endpoint + ":" + idempotencyKey;
    }

    static String lockKey(String endpoint, String idempotencyKey) {
        return LOCK_KEY_PREFIX + endpoint + ":" + idempotencyKey;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StoredResponse {
        private int status;
        private Map<String, Object> body;
    }
}
