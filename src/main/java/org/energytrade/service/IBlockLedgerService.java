package org.energytrade.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.energytrade.domain.BlockStats;
import org.energytrade.domain.BlockStatus;
import org.energytrade.domain.Offer;
import org.energytrade.domain.OfferBlock;

import java.util.List;
import java.util.Map;

/**
 * 区块账本服务
 * 唯一允许修改 OfferBlock.status 的组件
 */
public interface IBlockLedgerService extends IService<OfferBlock> {

    /**
     * 新报价首次同步时按 max_qty 批量创建AVAILABLE区块
     *
     * @return 创建的区块数
     */
    int materialize(Offer offer);

    /**
     * 原子地预留 quantity 个区块（先进先出）
     * - 单条UPDATE，每个区块都带版本前置条件，要么全部成功要么全部回滚
     * - 版本冲突时有限次重试，重试耗尽后抛出 InsufficientAvailableException
     *
     * @return 预留成功的区块ID
     * @throws org.energytrade.exception.InsufficientAvailableException 可用区块不足
     */
    List<String> claim(String offerId, int quantity, String orderId, String transactionId);

    /**
     * RESERVED → SOLD
     */
    void finalizeBlocks(List<String> blockIds);

    /**
     * RESERVED → AVAILABLE
     */
    void release(List<String> blockIds);

    /**
     * 把订单占用的RESERVED区块全部标记为SOLD
     *
     * @return 变更的区块数
     */
    int finalizeForOrder(String orderId);

    /**
     * 释放订单占用的RESERVED区块
     *
     * @return 释放的区块数
     */
    int releaseForOrder(String orderId);

    List<OfferBlock> listByOrder(String orderId);

    BlockStats getBlockStats(String offerId);

    /**
     * 所有报价的AVAILABLE区块数
     */
    Map<String, Integer> countAvailableByOffer();

    int countAvailable(String offerId);

    /**
     * 卖方侧批量状态同步（幂等）
     *
     * @return 实际发生变更的区块数
     */
    int applyStatusSync(String offerId, List<String> blockIds, BlockStatus target,
                        String orderId, String transactionId);

    /**
     * 显式重同步：刷新AVAILABLE区块的价格/时间快照
     */
    int resyncSnapshots(Offer offer);

    /**
     * 删除报价下仍为AVAILABLE的区块，RESERVED/SOLD区块保留
     */
    int deleteAvailableByOffer(String offerId);
}
