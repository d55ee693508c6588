package org.energytrade.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.energytrade.cache.CaffeineKeyValueCache;
import org.energytrade.config.TradeProperties;
import org.energytrade.exception.IdempotencyConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdempotencyKeyUtilTest {

    private final CaffeineKeyValueCache cache = new CaffeineKeyValueCache(1000);
    private final IdempotencyKeyUtil util =
            new IdempotencyKeyUtil(cache, new ObjectMapper(), new TradeProperties());

    private static ResponseEntity<Map<String, Object>> ok(int n) {
        Map<String, Object> body = new HashMap<>();
        body.put("code", "SUCCESS");
        body.put("n", n);
        return ResponseEntity.ok(body);
    }

    @Test
    @DisplayName("同一幂等键只执行一次，重试返回缓存结果")
    void replaysCachedResponse() {
        AtomicInteger calls = new AtomicInteger();

        ResponseEntity<Map<String, Object>> first = util.execute("cancel", "key-1", () -> ok(calls.incrementAndGet()));
        ResponseEntity<Map<String, Object>> second = util.execute("cancel", "key-1", () -> ok(calls.incrementAndGet()));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(second.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(second.getBody()).containsEntry("n", 1);
        assertThat(second.getHeaders().getFirst(IdempotencyKeyUtil.REPLAY_HEADER)).isEqualTo("true");
        assertThat(first.getHeaders().getFirst(IdempotencyKeyUtil.REPLAY_HEADER)).isNull();
    }

    @Test
    @DisplayName("没有幂等键时每次都执行")
    void noKeyAlwaysExecutes() {
        AtomicInteger calls = new AtomicInteger();

        util.execute("cancel", null, () -> ok(calls.incrementAndGet()));
        util.execute("cancel", " ", () -> ok(calls.incrementAndGet()));

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("处理中的同键请求返回冲突")
    void concurrentSameKeyConflicts() {
        cache.setIfAbsent(IdempotencyKeyUtil.lockKey("cancel", "key-2"), "other", Duration.ofMinutes(1));

        assertThatThrownBy(() -> util.execute("cancel", "key-2", () -> ok(1)))
                .isInstanceOf(IdempotencyConflictException.class);
    }

    @Test
    @DisplayName("处理超过锁TTL时，不删除其他请求新加的锁")
    void doesNotReleaseLockTakenOverByAnotherRequest() {
        String lockKey = IdempotencyKeyUtil.lockKey("cancel", "key-6");

        util.execute("cancel", "key-6", () -> {
            // 锁过期后另一个请求拿到了锁
            cache.delete(lockKey);
            cache.setIfAbsent(lockKey, "later-request", Duration.ofMinutes(1));
            return ok(1);
        });

        assertThat(cache.get(lockKey)).isEqualTo("later-request");
    }

    @Test
    @DisplayName("失败不缓存，释放锁后可以重试")
    void failureReleasesLock() {
        assertThatThrownBy(() -> util.execute("cancel", "key-3", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        ResponseEntity<Map<String, Object>> retry = util.execute("cancel", "key-3", () -> ok(7));

        assertThat(retry.getBody()).containsEntry("n", 7);
        assertThat(cache.get(IdempotencyKeyUtil.lockKey("cancel", "key-3"))).isNull();
    }

    @Test
    @DisplayName("非2xx响应不缓存")
    void errorResponseNotCached() {
        AtomicInteger calls = new AtomicInteger();
        Map<String, Object> body = new HashMap<>();
        body.put("code", "40001");

        util.execute("cancel", "key-4", () -> {
            calls.incrementAndGet();
            return ResponseEntity.badRequest().body(body);
        });
        util.execute("cancel", "key-4", () -> ok(calls.incrementAndGet()));

        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("不同端点的同名幂等键互不影响")
    void keysAreScopedByEndpoint() {
        util.execute("buyer-cancel:o1", "same", () -> ok(1));
        ResponseEntity<Map<String, Object>> other = util.execute("buyer-cancel:o2", "same", () -> ok(2));

        assertThat(other.getBody()).containsEntry("n", 2);
    }
}
