package org.energytrade.domain;

/**
 * 删除报价的结果
 */
public enum OfferDeletion {
    /**
     * 报价及全部区块已删除
     */
    DELETED,
    /**
     * 存在RESERVED/SOLD区块，改为软删除
     */
    DISABLED,
    /**
     * 报价不存在（重复删除）
     */
    ABSENT
}
