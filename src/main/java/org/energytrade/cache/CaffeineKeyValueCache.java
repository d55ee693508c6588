package org.energytrade.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;

import java.time.Duration;

/**
 * 进程内实现，每个条目单独设置过期时间
 * 用于本地运行和测试，多实例部署必须使用Redis
 */
public class CaffeineKeyValueCache implements IKeyValueCache {

    private final Cache<String, Entry> cache;

    public CaffeineKeyValueCache(long maximumSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new Expiry<String, Entry>() {
                    @Override
                    public long expireAfterCreate(String key, Entry entry, long currentTime) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
                        return entry.ttlNanos;
                    }

                    @Override
                    public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
                        return currentDuration;
                    }
                })
                .build();
    }

    @Override
    public String get(String key) {
        Entry entry = cache.getIfPresent(key);
        return entry == null ? null : entry.value;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        cache.put(key, new Entry(value, ttl));
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return cache.asMap().putIfAbsent(key, new Entry(value, ttl)) == null;
    }

    @Override
    public void delete(String key) {
        cache.invalidate(key);
    }

    @Override
    public boolean deleteIfEquals(String key, String expectedValue) {
        boolean[] removed = new boolean[1];
        cache.asMap().computeIfPresent(key, (k, entry) -> {
            if (entry.value.equals(expectedValue)) {
                removed[0] = true;
                return null;
            }
            return entry;
        });
        return removed[0];
    }

    private static final class Entry {
        private final String value;
        private final long ttlNanos;

        private Entry(String value, Duration ttl) {
            this.value = value;
            this.ttlNanos = ttl.toNanos();
        }
    }
}
