package org.energytrade.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.energytrade.domain.TrustScoreHistory;

@Mapper
public interface TrustScoreHistoryMapper extends BaseMapper<TrustScoreHistory> {
}
