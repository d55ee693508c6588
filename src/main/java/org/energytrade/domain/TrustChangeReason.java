package org.energytrade.domain;

public enum TrustChangeReason {
    DELIVERY,
    BUYER_CANCEL,
    SELLER_CANCEL,
    VERIFICATION
}
