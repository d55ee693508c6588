package org.energytrade.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 订单状态及合法流转表
 * 所有状态变更都必须经过 {@link #canTransitionTo(OrderStatus)} 校验
 */
public enum OrderStatus {

    DRAFT,
    PENDING,
    ACTIVE,
    DELIVERING,
    DELIVERED,
    COMPLETED,
    CANCELLED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(PENDING));
        TRANSITIONS.put(PENDING, EnumSet.of(ACTIVE));
        TRANSITIONS.put(ACTIVE, EnumSet.of(DELIVERING, CANCELLED));
        TRANSITIONS.put(DELIVERING, EnumSet.of(DELIVERED, CANCELLED));
        TRANSITIONS.put(DELIVERED, EnumSet.of(COMPLETED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return target != null && TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }
}
