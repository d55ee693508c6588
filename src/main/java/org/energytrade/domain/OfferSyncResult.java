package org.energytrade.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OfferSyncResult {
    private String offerId;
    /**
     * 首次同步（触发区块创建）
     */
    private boolean created;
    private int blocksCreated;
    private int blocksResynced;
}
