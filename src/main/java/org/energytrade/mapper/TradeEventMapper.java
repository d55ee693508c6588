package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.energytrade.domain.TradeEvent;

@Mapper
public interface TradeEventMapper extends BaseMapper<TradeEvent> {

    /**
     * 按消息ID和方向计数，去重的存储层兜底查询
     */
    @Select("""
            SELECT COUNT(*) FROM events
            WHERE message_id = #{messageId}
              AND direction = #{direction}
            """)
    long countByMessageIdAndDirection(@Param("messageId") String messageId,
                                      @Param("direction") String direction);
}
