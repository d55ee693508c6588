package org.energytrade.domain;

public enum TrustSubjectType {
    PROVIDER,
    PARTICIPANT
}
