package org.energytrade.config;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.cache.CaffeineKeyValueCache;
import org.energytrade.cache.IKeyValueCache;
import org.energytrade.cache.RedisKeyValueCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 缓存实现选择
 * - energy-trade.cache.type=redis（默认）：多实例共享
 * - energy-trade.cache.type=caffeine：进程内，本地和测试使用
 */
@Slf4j
@Configuration
public class CacheConfig {

    @Bean
    @ConditionalOnProperty(name = "energy-trade.cache.type", havingValue = "redis", matchIfMissing = true)
    public IKeyValueCache redisKeyValueCache(StringRedisTemplate stringRedisTemplate) {
        log.info("[缓存初始化] 使用Redis缓存");
        return new RedisKeyValueCache(stringRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "energy-trade.cache.type", havingValue = "caffeine")
    public IKeyValueCache caffeineKeyValueCache(TradeProperties properties) {
        log.info("[缓存初始化] 使用进程内Caffeine缓存, maximumSize={}", properties.getCache().getMaximumSize());
        return new CaffeineKeyValueCache(properties.getCache().getMaximumSize());
    }
}
