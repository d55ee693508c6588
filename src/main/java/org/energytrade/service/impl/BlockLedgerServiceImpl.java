package org.energytrade.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.energytrade.config.TradeProperties;
import org.energytrade.domain.BlockStats;
import org.energytrade.domain.BlockStatus;
import org.energytrade.domain.Offer;
import org.energytrade.domain.OfferBlock;
import org.energytrade.domain.OfferBlockCount;
import org.energytrade.exception.ConflictException;
import org.energytrade.exception.InsufficientAvailableException;
import org.energytrade.exception.InvalidTransitionException;
import org.energytrade.exception.ValidationException;
import org.energytrade.mapper.OfferBlockMapper;
import org.energytrade.service.IBlockLedgerService;
import org.energytrade.util.TraceIdUtil;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 区块账本实现
 *
 * 核心设计思想：
 * 1. 乐观锁：每个区块的UPDATE都带上读取时的version，版本由数据库触发器自增
 * 2. 单语句批量：N个区块的预留在一条UPDATE里完成，缩小竞争窗口
 * 3. 全有或全无：更新行数不等于请求数时整体回滚
 * 4. 有限重试：冲突后重新读取，重试耗尽升级为可用不足
 * 5. 存储层兜底：状态CHECK约束、订单关联约束保证即使代码有缺陷也不会超卖
 *
 * 预留流程：
 * 1. 读取最早创建的N个AVAILABLE区块（含version）
 * 2. 不足N个直接返回可用不足
 * 3. 单条UPDATE带版本条件批量预留
 * 4. 更新行数 != N 则抛出冲突并回滚
 * 5. 冲突时退避重试
 */
@Slf4j
@Service
public class BlockLedgerServiceImpl extends ServiceImpl<OfferBlockMapper, OfferBlock> implements IBlockLedgerService {

    private static final String BLOCK_ID_FORMAT = "block-%s-%d";

    private final OfferBlockMapper offerBlockMapper;
    private final TransactionTemplate claimTransactionTemplate;
    private final TradeProperties properties;

    public BlockLedgerServiceImpl(OfferBlockMapper offerBlockMapper,
                                  PlatformTransactionManager transactionManager,
                                  TradeProperties properties) {
        this.offerBlockMapper = offerBlockMapper;
        this.properties = properties;
        this.claimTransactionTemplate = new TransactionTemplate(transactionManager);
        // 每次尝试都是独立事务，冲突回滚不影响外层
        this.claimTransactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int materialize(Offer offer) {
        int quantity = offer.getMaxQty() == null ? 0 : offer.getMaxQty();
        if (quantity <= 0) {
            log.warn("[区块创建跳过] offerId={}, maxQty={}, traceId={}",
                    offer.getId(), offer.getMaxQty(), TraceIdUtil.getTraceId());
            return 0;
        }
        LocalDateTime now = LocalDateTime.now();
        List<OfferBlock> blocks = new ArrayList<>(quantity);
        for (int i = 0; i < quantity; i++) {
            blocks.add(OfferBlock.builder()
                    .id(String.format(BLOCK_ID_FORMAT, offer.getId(), i))
                    .offerId(offer.getId())
                    .itemId(offer.getItemId())
                    .providerId(offer.getProviderId())
                    .seq(i)
                    .status(BlockStatus.AVAILABLE)
                    .version(0L)
                    .priceValue(offer.getPriceValue())
                    .currency(offer.getCurrency())
                    .windowStart(offer.getWindowStart())
                    .windowEnd(offer.getWindowEnd())
                    .createTime(now)
                    .build());
        }
        saveBatch(blocks);
        log.info("[区块创建成功] offerId={}, blockCount={}, traceId={}",
                offer.getId(), quantity, TraceIdUtil.getTraceId());
        return quantity;
    }

    @Override
    public List<String> claim(String offerId, int quantity, String orderId, String transactionId) {
        if (offerId == null || orderId == null) {
            throw new ValidationException("offerId and orderId are required to claim blocks");
        }
        if (quantity <= 0) {
            throw new ValidationException("Claim quantity must be positive: " + quantity);
        }
        String traceId = TraceIdUtil.getTraceId();
        int maxAttempts = Math.max(1, properties.getLedger().getClaimMaxAttempts());

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                List<String> claimed = claimTransactionTemplate.execute(
                        status -> claimOnce(offerId, quantity, orderId, transactionId));
                log.info("[区块预留成功] offerId={}, quantity={}, orderId={}, attempt={}, traceId={}",
                        offerId, quantity, orderId, attempt, traceId);
                return claimed;
            } catch (ConflictException | ConcurrencyFailureException e) {
                log.warn("[乐观锁冲突] 区块预留失败，offerId={}, orderId={}, attempt={}/{}, errorMsg={}, traceId={}",
                        offerId, orderId, attempt, maxAttempts, e.getMessage(), traceId);
                backoff(attempt);
            }
        }

        int available = countAvailable(offerId);
        log.warn("[区块预留重试耗尽] offerId={}, quantity={}, available={}, orderId={}, traceId={}",
                offerId, quantity, available, orderId, traceId);
        throw new InsufficientAvailableException(offerId, quantity, available);
    }

    private List<String> claimOnce(String offerId, int quantity, String orderId, String transactionId) {
        // ==================== 1. 读取候选区块 ====================
        List<OfferBlock> candidates = offerBlockMapper.selectAvailableBlocks(offerId, quantity);
        if (candidates.size() < quantity) {
            throw new InsufficientAvailableException(offerId, quantity, candidates.size());
        }

        // ==================== 2. 单语句批量预留（乐观锁） ====================
        int updatedRows = offerBlockMapper.claimBlocksWithOptimisticLock(
                offerId, candidates, orderId, transactionId, LocalDateTime.now());

        // ==================== 3. 全有或全无 ====================
        if (updatedRows != quantity) {
            throw new ConflictException("Claimed " + updatedRows + " of " + quantity
                    + " blocks for offer " + offerId + ", version changed concurrently");
        }
        return candidates.stream().map(OfferBlock::getId).collect(Collectors.toList());
    }

    private void backoff(int attempt) {
        long backoffMs = properties.getLedger().getClaimRetryBackoffMs() * attempt;
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConflictException("Claim retry interrupted", e);
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void finalizeBlocks(List<String> blockIds) {
        if (blockIds == null || blockIds.isEmpty()) {
            return;
        }
        int updatedRows = offerBlockMapper.markBlocksSold(blockIds, LocalDateTime.now());
        if (updatedRows != blockIds.size()) {
            OfferBlock offending = findFirstNotInStatus(blockIds, BlockStatus.RESERVED);
            throw new InvalidTransitionException("block", offending == null ? blockIds.toString() : offending.getId(),
                    offending == null ? null : offending.getStatus(), BlockStatus.SOLD);
        }
        log.info("[区块售出] blockCount={}, traceId={}", updatedRows, TraceIdUtil.getTraceId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void release(List<String> blockIds) {
        if (blockIds == null || blockIds.isEmpty()) {
            return;
        }
        int updatedRows = offerBlockMapper.releaseBlocks(blockIds);
        if (updatedRows != blockIds.size()) {
            OfferBlock offending = findFirstNotInStatus(blockIds, BlockStatus.RESERVED);
            throw new InvalidTransitionException("block", offending == null ? blockIds.toString() : offending.getId(),
                    offending == null ? null : offending.getStatus(), BlockStatus.AVAILABLE);
        }
        log.info("[区块释放] blockCount={}, traceId={}", updatedRows, TraceIdUtil.getTraceId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int finalizeForOrder(String orderId) {
        List<String> reserved = idsInStatus(orderId, BlockStatus.RESERVED);
        finalizeBlocks(reserved);
        return reserved.size();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int releaseForOrder(String orderId) {
        List<String> reserved = idsInStatus(orderId, BlockStatus.RESERVED);
        release(reserved);
        return reserved.size();
    }

    @Override
    public List<OfferBlock> listByOrder(String orderId) {
        return lambdaQuery()
                .eq(OfferBlock::getOrderId, orderId)
                .orderByAsc(OfferBlock::getSeq)
                .list();
    }

    @Override
    public BlockStats getBlockStats(String offerId) {
        BlockStats stats = BlockStats.builder().offerId(offerId).build();
        for (OfferBlockCount count : offerBlockMapper.countByStatus(offerId)) {
            long value = count.getBlockCount() == null ? 0 : count.getBlockCount();
            switch (count.getStatus()) {
                case AVAILABLE -> stats.setAvailable(value);
                case RESERVED -> stats.setReserved(value);
                case SOLD -> stats.setSold(value);
            }
        }
        stats.setTotal(stats.getAvailable() + stats.getReserved() + stats.getSold());
        return stats;
    }

    @Override
    public Map<String, Integer> countAvailableByOffer() {
        Map<String, Integer> result = new HashMap<>();
        for (OfferBlockCount count : offerBlockMapper.countAllByStatus()) {
            if (count.getStatus() == BlockStatus.AVAILABLE && count.getBlockCount() != null) {
                result.put(count.getOfferId(), count.getBlockCount().intValue());
            }
        }
        return result;
    }

    @Override
    public int countAvailable(String offerId) {
        return Math.toIntExact(lambdaQuery()
                .eq(OfferBlock::getOfferId, offerId)
                .eq(OfferBlock::getStatus, BlockStatus.AVAILABLE)
                .count());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int applyStatusSync(String offerId, List<String> blockIds, BlockStatus target,
                               String orderId, String transactionId) {
        if (offerId == null || target == null || blockIds == null || blockIds.isEmpty()) {
            throw new ValidationException("offerId, blockIds and status are required");
        }
        if (target.requiresOrder() && orderId == null) {
            throw new ValidationException("orderId is required for status " + target);
        }
        List<OfferBlock> blocks = listByIds(blockIds);
        if (blocks.size() != blockIds.size()) {
            throw new ValidationException("Unknown block ids for offer " + offerId);
        }

        int changed = 0;
        LocalDateTime now = LocalDateTime.now();
        for (OfferBlock block : blocks) {
            if (!offerId.equals(block.getOfferId())) {
                throw new ValidationException("Block " + block.getId() + " does not belong to offer " + offerId);
            }
            // 已处于目标状态视为重复同步
            if (block.getStatus() == target
                    && (target == BlockStatus.AVAILABLE || Objects.equals(orderId, block.getOrderId()))) {
                continue;
            }
            if (!block.getStatus().canTransitionTo(target)) {
                throw new InvalidTransitionException("block", block.getId(), block.getStatus(), target);
            }
            boolean available = target == BlockStatus.AVAILABLE;
            int updatedRows = offerBlockMapper.updateBlockStatus(
                    block.getId(),
                    block.getVersion(),
                    block.getStatus().name(),
                    target.name(),
                    available ? null : orderId,
                    available ? null : transactionId,
                    available ? null : (block.getReservedAt() != null ? block.getReservedAt() : now),
                    target == BlockStatus.SOLD ? now : null);
            if (updatedRows == 0) {
                throw new ConflictException("Block " + block.getId() + " changed concurrently");
            }
            changed++;
        }
        log.info("[区块状态同步] offerId={}, target={}, requested={}, changed={}, traceId={}",
                offerId, target, blockIds.size(), changed, TraceIdUtil.getTraceId());
        return changed;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int resyncSnapshots(Offer offer) {
        int updatedRows = offerBlockMapper.resyncAvailableSnapshots(offer.getId(), offer.getPriceValue(),
                offer.getCurrency(), offer.getWindowStart(), offer.getWindowEnd());
        log.info("[区块快照重同步] offerId={}, updatedRows={}, traceId={}",
                offer.getId(), updatedRows, TraceIdUtil.getTraceId());
        return updatedRows;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int deleteAvailableByOffer(String offerId) {
        return offerBlockMapper.delete(new LambdaQueryWrapper<OfferBlock>()
                .eq(OfferBlock::getOfferId, offerId)
                .eq(OfferBlock::getStatus, BlockStatus.AVAILABLE));
    }

    private List<String> idsInStatus(String orderId, BlockStatus status) {
        return lambdaQuery()
                .eq(OfferBlock::getOrderId, orderId)
                .eq(OfferBlock::getStatus, status)
                .list()
                .stream()
                .map(OfferBlock::getId)
                .collect(Collectors.toList());
    }

    private OfferBlock findFirstNotInStatus(List<String> blockIds, BlockStatus expected) {
        return listByIds(blockIds).stream()
                .filter(block -> block.getStatus() != expected)
                .findFirst()
                .orElse(null);
    }
}
