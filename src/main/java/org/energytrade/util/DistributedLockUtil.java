package org.energytrade.util;

import lombok.extern.slf4j.Slf4j;
import org.energytrade.exception.ConflictException;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 分布式锁工具类
 * - 基于Redisson实现分布式可重入锁
 * - 未配置RedissonClient时退化为空操作，正确性由数据库乐观锁保证
 * - 用于订单状态变更等需要串行化的操作
 */
@Slf4j
@Component
public class DistributedLockUtil {

    private static DistributedLockUtil instance;
    private final RedissonClient redissonClient;

    private static final String LOCK_KEY_PREFIX = "lock:";

    public DistributedLockUtil(@Autowired(required = false) RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
        instance = this;
    }

    public static boolean tryLock(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        if (instance == null || instance.redissonClient == null) {
            return true;
        }
        return instance.tryLockInternal(resourceKey, waitTime, leaseTime, unit);
    }

    private boolean tryLockInternal(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        try {
            return lock.tryLock(waitTime, leaseTime, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static void unlock(String resourceKey) {
        if (instance == null || instance.redissonClient == null) {
            return;
        }
        RLock lock = instance.redissonClient.getLock(buildLockKey(resourceKey));
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        }
    }

    /**
     * 加锁执行业务逻辑，拿不到锁时抛出 {@link ConflictException}
     * 业务异常原样抛出，锁在finally中释放
     */
    public static <T> T executeWithLock(String resourceKey, long waitTime, long leaseTime, TimeUnit unit,
                                        Supplier<T> operation) {
        boolean lockAcquired = tryLock(resourceKey, waitTime, leaseTime, unit);
        if (!lockAcquired) {
            log.warn("[获取分布式锁失败] resourceKey={}, 资源被占用", resourceKey);
            throw new ConflictException("Resource " + resourceKey + " is busy, retry later");
        }
        try {
            log.debug("[获取分布式锁成功] resourceKey={}", resourceKey);
            return operation.get();
        } finally {
            unlock(resourceKey);
            log.debug("[释放分布式锁] resourceKey={}", resourceKey);
        }
    }

    private static String buildLockKey(String resourceKey) {
        return LOCK_KEY_PREFIX + resourceKey;
    }
}
