package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.energytrade.domain.Provider;

@Mapper
public interface ProviderMapper extends BaseMapper<Provider> {

    /**
     * 行锁读取，信任分读改写在事务内串行
     */
    @Select("SELECT * FROM providers WHERE id = #{id} FOR UPDATE")
    Provider selectByIdForUpdate(@Param("id") String id);
}
