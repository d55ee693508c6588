package org.energytrade.service.impl;

import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.Participant;
import org.energytrade.domain.Provider;
import org.energytrade.domain.TrustScoreHistory;
import org.energytrade.mapper.TrustScoreHistoryMapper;
import org.energytrade.service.ITrustService;
import org.energytrade.support.IntegrationTestSupport;
import org.energytrade.util.TraceIdUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 信任分并发更新集成测试
 * 同一主体的并发更新不能丢失
 */
@Slf4j
class TrustServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private ITrustService trustService;

    @Autowired
    private TrustScoreHistoryMapper trustScoreHistoryMapper;

    @Test
    @DisplayName("并发交付核验：订单计数和信任分不丢更新")
    void concurrentDeliveryOutcomesAreAllApplied() throws Exception {
        Provider provider = seedProvider();
        int threadCount = 20;

        int failures = runConcurrently(threadCount, threadNo -> trustService.applyDeliveryOutcome(
                provider.getId(), "order-" + provider.getId() + "-" + threadNo, 10, 10));

        assertThat(failures).isZero();
        Provider updated = catalogService.getProvider(provider.getId());
        assertThat(updated.getTotalOrders()).isEqualTo(threadCount);
        assertThat(updated.getSuccessfulOrders()).isEqualTo(threadCount);
        // 0.3 + 20 × 0.02
        assertThat(updated.getTrustScore()).isEqualTo(0.7);
        assertThat(trustScoreHistoryMapper.selectCount(Wrappers.<TrustScoreHistory>lambdaQuery()
                .eq(TrustScoreHistory::getSubjectId, provider.getId()))).isEqualTo(threadCount);
    }

    @Test
    @DisplayName("并发买方取消扣分：每次扣分都生效")
    void concurrentBuyerCancelsAreAllApplied() throws Exception {
        Participant buyer = seedBuyer(100);
        int threadCount = 5;

        int failures = runConcurrently(threadCount, threadNo -> trustService.applyBuyerCancel(
                buyer.getId(), "order-" + buyer.getId() + "-" + threadNo, 10, 10, true));

        assertThat(failures).isZero();
        // 0.3 - 5 × 0.03
        assertThat(participantService.getRequired(buyer.getId()).getTrustScore()).isEqualTo(0.15);
    }

    private static int runConcurrently(int threadCount, IntConsumer task) throws InterruptedException {
        ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger failureCount = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            final int threadNo = i;
            executorService.execute(() -> {
                TraceIdUtil.setTraceId(TraceIdUtil.generateTraceId());
                try {
                    ready.countDown();
                    start.await();
                    task.accept(threadNo);
                } catch (Exception e) {
                    failureCount.incrementAndGet();
                    log.error("线程[{}] 异常: {}", threadNo, e.getMessage(), e);
                } finally {
                    TraceIdUtil.clearTraceId();
                    done.countDown();
                }
            });
        }
        ready.await(10, TimeUnit.SECONDS);
        start.countDown();
        assertThat(done.await(60, TimeUnit.SECONDS)).isTrue();
        executorService.shutdown();
        return failureCount.get();
    }
}
