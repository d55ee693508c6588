package org.energytrade.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 区块状态
 * AVAILABLE → RESERVED → SOLD，RESERVED 可释放回 AVAILABLE
 */
public enum BlockStatus {

    AVAILABLE,
    RESERVED,
    SOLD;

    private static final Map<BlockStatus, Set<BlockStatus>> TRANSITIONS = new EnumMap<>(BlockStatus.class);

    static {
        TRANSITIONS.put(AVAILABLE, EnumSet.of(RESERVED));
        TRANSITIONS.put(RESERVED, EnumSet.of(SOLD, AVAILABLE));
        TRANSITIONS.put(SOLD, EnumSet.noneOf(BlockStatus.class));
    }

    public boolean canTransitionTo(BlockStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<BlockStatus> allowedTargets() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * 该状态下区块必须关联订单
     */
    public boolean requiresOrder() {
        return this != AVAILABLE;
    }
}
