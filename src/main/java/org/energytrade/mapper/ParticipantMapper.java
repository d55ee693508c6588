package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.energytrade.domain.Participant;

@Mapper
public interface ParticipantMapper extends BaseMapper<Participant> {

    /**
     * 行锁读取，信任分读改写在事务内串行
     */
    @Select("SELECT * FROM participants WHERE id = #{id} FOR UPDATE")
    Participant selectByIdForUpdate(@Param("id") String id);
}
