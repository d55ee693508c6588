package org.energytrade.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineKeyValueCacheTest {

    private final CaffeineKeyValueCache cache = new CaffeineKeyValueCache(100);

    @Test
    @DisplayName("SET NX 只有第一次成功")
    void setIfAbsentOnlyOnce() {
        assertThat(cache.setIfAbsent("k", "first", Duration.ofMinutes(1))).isTrue();
        assertThat(cache.setIfAbsent("k", "second", Duration.ofMinutes(1))).isFalse();
        assertThat(cache.get("k")).isEqualTo("first");
    }

    @Test
    @DisplayName("删除后可以重新设置")
    void deleteFreesKey() {
        cache.set("k", "v", Duration.ofMinutes(1));
        cache.delete("k");

        assertThat(cache.get("k")).isNull();
        assertThat(cache.setIfAbsent("k", "again", Duration.ofMinutes(1))).isTrue();
    }

    @Test
    @DisplayName("值匹配时才删除")
    void deleteIfEqualsChecksValue() {
        cache.set("lock", "owner-a", Duration.ofMinutes(1));

        assertThat(cache.deleteIfEquals("lock", "owner-b")).isFalse();
        assertThat(cache.get("lock")).isEqualTo("owner-a");
        assertThat(cache.deleteIfEquals("lock", "owner-a")).isTrue();
        assertThat(cache.get("lock")).isNull();
        assertThat(cache.deleteIfEquals("lock", "owner-a")).isFalse();
    }

    @Test
    @DisplayName("过期条目不可见")
    void expiredEntryIsGone() throws InterruptedException {
        cache.set("short", "v", Duration.ofMillis(20));
        cache.set("long", "v", Duration.ofMinutes(5));

        Thread.sleep(100);

        assertThat(cache.get("short")).isNull();
        assertThat(cache.get("long")).isEqualTo("v");
    }
}
