package org.energytrade.cache;

import java.time.Duration;

/**
 * 带TTL的键值缓存
 * 缓存只做加速，任何不变量都不能依赖缓存命中
 */
public interface IKeyValueCache {

    /**
     * @return 值，不存在或已过期返回null
     */
    String get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * 原子地在key不存在时写入
     *
     * @return true: 写入成功；false: key已存在
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void delete(String key);

    /**
     * 值等于 expectedValue 时才删除，比较与删除是原子的
     *
     * @return true: 已删除；false: key不存在或值已被他人改写
     */
    boolean deleteIfEquals(String key, String expectedValue);
}
