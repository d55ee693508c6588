package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.energytrade.domain.ProtocolTransaction;

@Mapper
public interface ProtocolTransactionMapper extends BaseMapper<ProtocolTransaction> {
}
