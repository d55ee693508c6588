package org.energytrade.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 报价下区块按状态的统计
 * 守恒关系：available + reserved + sold == total
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BlockStats {
    private String offerId;
    private long total;
    private long available;
    private long reserved;
    private long sold;
}
