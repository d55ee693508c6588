package org.energytrade.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 已认证主体（由外部会话系统提供）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuthenticatedPrincipal {
    private String userId;
    private double trustScore;
    /**
     * 申报容量（kWh），0表示未申报
     */
    private double declaredCapacity;
    /**
     * 关联卖方ID，纯买方为空
     */
    private String providerId;
}
