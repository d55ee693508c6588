package org.energytrade.domain;

import java.util.Locale;

public enum SourceType {
    SOLAR,
    WIND,
    HYDRO,
    BIOMASS,
    OTHER;

    /**
     * 无法识别的能源类型归为OTHER
     */
    public static SourceType parse(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
