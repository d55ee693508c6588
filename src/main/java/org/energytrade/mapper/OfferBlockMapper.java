package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;
import org.energytrade.domain.OfferBlock;
import org.energytrade.domain.OfferBlockCount;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 区块Mapper
 * 注意：所有UPDATE都不手动修改version，由数据库触发器自增
 */
@Mapper
public interface OfferBlockMapper extends BaseMapper<OfferBlock> {

    /**
     * 按创建顺序读取前N个可用区块（先进先出），报价须为ACTIVE
     */
    @Select("""
            SELECT * FROM offer_blocks
            WHERE offer_id = #{offerId}
              AND status = 'AVAILABLE'
              AND EXISTS (SELECT 1 FROM offers o WHERE o.id = #{offerId} AND o.status = 'ACTIVE')
            ORDER BY create_time, seq
            LIMIT #{limit}
            """)
    List<OfferBlock> selectAvailableBlocks(@Param("offerId") String offerId, @Param("limit") int limit);

    /**
     * 批量预留区块（乐观锁版本）
     * 每个区块都带上读取时的version作为前置条件，单条语句完成
     * 报价已下架（DISABLED或已删除）时不更新任何行
     *
     * @return 更新行数，小于区块数说明存在并发冲突
     */
    @Update("""
            <script>
            UPDATE offer_blocks
            SET status = 'RESERVED',
                order_id = #{orderId},
                transaction_id = #{transactionId},
                reserved_at = #{reservedAt}
            WHERE offer_id = #{offerId}
              AND status = 'AVAILABLE'
              AND EXISTS (SELECT 1 FROM offers o WHERE o.id = #{offerId} AND o.status = 'ACTIVE')
              AND (
                <foreach collection="blocks" item="b" separator=" OR ">
                  (id = #{b.id} AND version = #{b.version})
                </foreach>
              )
            </script>
            """)
    int claimBlocksWithOptimisticLock(@Param("offerId") String offerId,
                                      @Param("blocks") List<OfferBlock> blocks,
                                      @Param("orderId") String orderId,
                                      @Param("transactionId") String transactionId,
                                      @Param("reservedAt") LocalDateTime reservedAt);

    /**
     * RESERVED → SOLD
     */
    @Update("""
            <script>
            UPDATE offer_blocks
            SET status = 'SOLD',
                sold_at = #{soldAt}
            WHERE status = 'RESERVED'
              AND id IN
              <foreach collection="blockIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
            </script>
            """)
    int markBlocksSold(@Param("blockIds") List<String> blockIds, @Param("soldAt") LocalDateTime soldAt);

    /**
     * RESERVED → AVAILABLE，清空订单关联
     */
    @Update("""
            <script>
            UPDATE offer_blocks
            SET status = 'AVAILABLE',
                order_id = NULL,
                transaction_id = NULL,
                reserved_at = NULL
            WHERE status = 'RESERVED'
              AND id IN
              <foreach collection="blockIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
            </script>
            """)
    int releaseBlocks(@Param("blockIds") List<String> blockIds);

    /**
     * 单个区块状态变更（同步接口使用，带版本前置条件）
     */
    @Update("""
            UPDATE offer_blocks
            SET status = #{target},
                order_id = #{orderId},
                transaction_id = #{transactionId},
                reserved_at = #{reservedAt},
                sold_at = #{soldAt}
            WHERE id = #{id}
              AND version = #{version}
              AND status = #{current}
            """)
    int updateBlockStatus(@Param("id") String id,
                          @Param("version") Long version,
                          @Param("current") String current,
                          @Param("target") String target,
                          @Param("orderId") String orderId,
                          @Param("transactionId") String transactionId,
                          @Param("reservedAt") LocalDateTime reservedAt,
                          @Param("soldAt") LocalDateTime soldAt);

    /**
     * 更新可用区块的价格与时间快照（显式重同步）
     */
    @Update("""
            UPDATE offer_blocks
            SET price_value = #{priceValue},
                currency = #{currency},
                window_start = #{windowStart},
                window_end = #{windowEnd}
            WHERE offer_id = #{offerId}
              AND status = 'AVAILABLE'
            """)
    int resyncAvailableSnapshots(@Param("offerId") String offerId,
                                 @Param("priceValue") Double priceValue,
                                 @Param("currency") String currency,
                                 @Param("windowStart") LocalDateTime windowStart,
                                 @Param("windowEnd") LocalDateTime windowEnd);

    @Select("""
            SELECT offer_id, status, COUNT(*) AS block_count
            FROM offer_blocks
            WHERE offer_id = #{offerId}
            GROUP BY offer_id, status
            """)
    List<OfferBlockCount> countByStatus(@Param("offerId") String offerId);

    @Select("""
            SELECT offer_id, status, COUNT(*) AS block_count
            FROM offer_blocks
            GROUP BY offer_id, status
            """)
    List<OfferBlockCount> countAllByStatus();

    /**
     * 卖方未售出区块数（AVAILABLE + RESERVED），用于上架额度校验
     */
    @Select("""
            SELECT COUNT(*) FROM offer_blocks
            WHERE provider_id = #{providerId}
              AND status IN ('AVAILABLE', 'RESERVED')
            """)
    long countOpenBlocksByProvider(@Param("providerId") String providerId);
}
