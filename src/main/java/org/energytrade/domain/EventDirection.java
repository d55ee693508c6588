package org.energytrade.domain;

public enum EventDirection {
    INBOUND,
    OUTBOUND
}
