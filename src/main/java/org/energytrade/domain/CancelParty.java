package org.energytrade.domain;

/**
 * 取消发起方
 */
public enum CancelParty {
    BUYER,
    SELLER
}
