package org.energytrade.domain;

/**
 * 报价状态，DISABLED 为软删除
 */
public enum OfferStatus {
    ACTIVE,
    DISABLED
}
