package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.energytrade.domain.TradeOrder;

@Mapper
public interface TradeOrderMapper extends BaseMapper<TradeOrder> {

    /**
     * 买方未结束订单占用的区块数（用于可交易额度校验）
     */
    @Select("""
            SELECT COALESCE(SUM(quantity), 0) FROM orders
            WHERE buyer_id = #{buyerId}
              AND status IN ('PENDING', 'ACTIVE', 'DELIVERING')
            """)
    long sumOpenQuantityByBuyer(@Param("buyerId") String buyerId);
}
