package org.energytrade.engine;

import lombok.Getter;

/**
 * 电表/资质核验置信度
 */
@Getter
public enum VerificationQuality {

    HIGH(1.0),
    MEDIUM(0.6),
    LOW(0.3);

    private final double factor;

    VerificationQuality(double factor) {
        this.factor = factor;
    }

    /**
     * 根据核验容量与申报容量的比值判定质量
     * - 偏差10%以内为HIGH，20%以内为MEDIUM，其余为LOW
     * - 申报容量缺失或为0时取最保守的LOW
     */
    public static VerificationQuality fromCapacity(Double verifiedCapacity, Double declaredCapacity) {
        if (verifiedCapacity == null || declaredCapacity == null || declaredCapacity <= 0) {
            return LOW;
        }
        double ratio = verifiedCapacity / declaredCapacity;
        if (ratio >= 0.9 && ratio <= 1.1) {
            return HIGH;
        }
        if (ratio >= 0.8 && ratio <= 1.2) {
            return MEDIUM;
        }
        return LOW;
    }
}
