package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.energytrade.domain.Offer;

@Mapper
public interface OfferMapper extends BaseMapper<Offer> {

    /**
     * 行锁读取，删除报价时与其他下架操作串行
     */
    @Select("SELECT * FROM offers WHERE id = #{id} FOR UPDATE")
    Offer selectByIdForUpdate(@Param("id") String id);
}
