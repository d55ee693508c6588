package org.energytrade.service.impl;

import com.baomidou.mybatisplus.core.toolkit.Wrappers;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.domain.BlockStats;
import org.energytrade.domain.BlockStatus;
import org.energytrade.domain.Offer;
import org.energytrade.domain.OfferBlock;
import org.energytrade.exception.InsufficientAvailableException;
import org.energytrade.exception.InvalidTransitionException;
import org.energytrade.exception.ValidationException;
import org.energytrade.mapper.OfferBlockMapper;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.support.IntegrationTestSupport;
import org.energytrade.util.TraceIdUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 区块账本集成测试
 * - 并发预留不会重复分配
 * - 区块守恒
 * - 版本号由触发器维护
 */
@Slf4j
class BlockLedgerServiceIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private IBlockLedgerService blockLedgerService;

    @Autowired
    private OfferBlockMapper offerBlockMapper;

    @Test
    @DisplayName("新报价按上架数量创建AVAILABLE区块")
    void materializeCreatesAvailableBlocks() {
        Offer offer = seedOffer(25, 6.5);

        BlockStats stats = blockLedgerService.getBlockStats(offer.getId());

        assertThat(stats.getTotal()).isEqualTo(25);
        assertThat(stats.getAvailable()).isEqualTo(25);
        assertThat(blockLedgerService.countAvailable(offer.getId())).isEqualTo(25);
    }

    @Test
    @DisplayName("预留按创建顺序先进先出")
    void claimIsFifo() {
        Offer offer = seedOffer(10, 5.0);

        List<String> first = blockLedgerService.claim(offer.getId(), 3, randomId("order"), randomId("txn"));

        assertThat(first).containsExactly(
                "block-" + offer.getId() + "-0",
                "block-" + offer.getId() + "-1",
                "block-" + offer.getId() + "-2");
    }

    @Test
    @DisplayName("可用不足时整体失败，不预留任何区块")
    void claimIsAllOrNothing() {
        Offer offer = seedOffer(5, 5.0);

        assertThatThrownBy(() -> blockLedgerService.claim(offer.getId(), 6, randomId("order"), randomId("txn")))
                .isInstanceOf(InsufficientAvailableException.class);
        assertThat(blockLedgerService.getBlockStats(offer.getId()).getAvailable()).isEqualTo(5);
    }

    @Test
    @DisplayName("数量非法直接拒绝")
    void claimRejectsNonPositiveQuantity() {
        Offer offer = seedOffer(5, 5.0);

        assertThatThrownBy(() -> blockLedgerService.claim(offer.getId(), 0, randomId("order"), randomId("txn")))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("每次更新版本号由触发器自增")
    void triggerBumpsVersion() {
        Offer offer = seedOffer(3, 5.0);
        String blockId = "block-" + offer.getId() + "-0";
        assertThat(blockLedgerService.getById(blockId).getVersion()).isZero();

        String orderId = randomId("order");
        blockLedgerService.claim(offer.getId(), 1, orderId, randomId("txn"));
        OfferBlock reserved = blockLedgerService.getById(blockId);
        assertThat(reserved.getStatus()).isEqualTo(BlockStatus.RESERVED);
        assertThat(reserved.getOrderId()).isEqualTo(orderId);
        assertThat(reserved.getVersion()).isEqualTo(1L);

        blockLedgerService.release(List.of(blockId));
        OfferBlock released = blockLedgerService.getById(blockId);
        assertThat(released.getStatus()).isEqualTo(BlockStatus.AVAILABLE);
        assertThat(released.getOrderId()).isNull();
        assertThat(released.getVersion()).isEqualTo(2L);
    }

    @Test
    @DisplayName("写回旧版本号无效，触发器保证版本单调递增")
    void versionCannotBeRolledBack() {
        Offer offer = seedOffer(2, 5.0);
        String blockId = "block-" + offer.getId() + "-0";
        blockLedgerService.claim(offer.getId(), 1, randomId("order"), randomId("txn"));
        assertThat(blockLedgerService.getById(blockId).getVersion()).isEqualTo(1L);

        offerBlockMapper.update(null, Wrappers.<OfferBlock>lambdaUpdate()
                .eq(OfferBlock::getId, blockId)
                .set(OfferBlock::getVersion, 0L));

        assertThat(blockLedgerService.getById(blockId).getVersion()).isEqualTo(2L);
    }

    @Test
    @DisplayName("按报价删除只删除AVAILABLE区块，在途区块保留")
    void deleteAvailableKeepsReservedBlocks() {
        Offer offer = seedOffer(10, 5.0);
        String orderId = randomId("order");
        List<String> claimed = blockLedgerService.claim(offer.getId(), 3, orderId, randomId("txn"));

        assertThat(blockLedgerService.deleteAvailableByOffer(offer.getId())).isEqualTo(7);

        BlockStats stats = blockLedgerService.getBlockStats(offer.getId());
        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getReserved()).isEqualTo(3);
        assertThat(blockLedgerService.listByOrder(orderId))
                .extracting(OfferBlock::getId)
                .containsExactlyInAnyOrderElementsOf(claimed);
    }

    @Test
    @DisplayName("售出后不能再释放")
    void soldBlocksCannotBeReleased() {
        Offer offer = seedOffer(4, 5.0);
        String orderId = randomId("order");
        List<String> claimed = blockLedgerService.claim(offer.getId(), 2, orderId, randomId("txn"));

        assertThat(blockLedgerService.finalizeForOrder(orderId)).isEqualTo(2);
        assertThat(blockLedgerService.listByOrder(orderId))
                .extracting(OfferBlock::getStatus)
                .containsOnly(BlockStatus.SOLD);

        assertThatThrownBy(() -> blockLedgerService.release(claimed))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(blockLedgerService.releaseForOrder(orderId)).isZero();

        BlockStats stats = blockLedgerService.getBlockStats(offer.getId());
        assertThat(stats.getSold()).isEqualTo(2);
        assertThat(stats.getAvailable()).isEqualTo(2);
    }

    @Test
    @DisplayName("卖方状态同步幂等")
    void statusSyncIsIdempotent() {
        Offer offer = seedOffer(4, 5.0);
        List<String> blockIds = List.of("block-" + offer.getId() + "-0", "block-" + offer.getId() + "-1");
        String orderId = randomId("ext-order");

        int first = blockLedgerService.applyStatusSync(offer.getId(), blockIds, BlockStatus.RESERVED, orderId, null);
        int second = blockLedgerService.applyStatusSync(offer.getId(), blockIds, BlockStatus.RESERVED, orderId, null);

        assertThat(first).isEqualTo(2);
        assertThat(second).isZero();
        assertThatThrownBy(() -> blockLedgerService.applyStatusSync(
                offer.getId(), blockIds, BlockStatus.SOLD, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> blockLedgerService.applyStatusSync(
                offer.getId(), List.of("block-" + offer.getId() + "-2"), BlockStatus.SOLD, orderId, null))
                .isInstanceOf(InvalidTransitionException.class);
    }

    /**
     * 20个线程各预留10个区块，共150个区块
     * 验证同一区块不会分配给两个订单，且区块总数守恒
     */
    @Test
    @DisplayName("并发预留不超卖")
    void concurrentClaimsNeverDoubleAllocate() throws Exception {
        Offer offer = seedOffer(150, 5.0);
        int threadCount = 20;
        int quantityPerThread = 10;

        ExecutorService executorService = Executors.newFixedThreadPool(10);
        CountDownLatch ready = new CountDownLatch(threadCount);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger insufficientCount = new AtomicInteger();
        List<String> allClaimed = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threadCount; i++) {
            final int threadNo = i;
            executorService.execute(() -> {
                TraceIdUtil.setTraceId(TraceIdUtil.generateTraceId());
                try {
                    ready.countDown();
                    start.await();
                    List<String> claimed = blockLedgerService.claim(offer.getId(), quantityPerThread,
                            "order-concurrent-" + offer.getId() + "-" + threadNo, randomId("txn"));
                    allClaimed.addAll(claimed);
                    successCount.incrementAndGet();
                } catch (InsufficientAvailableException e) {
                    insufficientCount.incrementAndGet();
                } catch (Exception e) {
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

        log.info("并发预留结果: success={}, insufficient={}", successCount.get(), insufficientCount.get());
        Set<String> unique = new HashSet<>(allClaimed);
        BlockStats stats = blockLedgerService.getBlockStats(offer.getId());

        assertThat(successCount.get() + insufficientCount.get()).isEqualTo(threadCount);
        assertThat(successCount.get()).isBetween(1, 15);
        assertThat(unique).hasSize(allClaimed.size());
        assertThat(stats.getReserved()).isEqualTo((long) successCount.get() * quantityPerThread);
        assertThat(stats.getAvailable() + stats.getReserved() + stats.getSold()).isEqualTo(150);
        assertThat(stats.getTotal()).isEqualTo(150);
    }
}
