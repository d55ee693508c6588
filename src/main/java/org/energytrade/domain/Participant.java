package org.energytrade.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import org.energytrade.engine.VerificationQuality;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 交易参与方（买方或兼任卖方的用户）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("participants")
public class Participant {
    @TableId(type = IdType.INPUT)
    private String id;
    private String name;
    private Double trustScore;
    /**
     * 可交易比例（%）
     */
    private Integer allowedLimit;
    /**
     * 申报容量（kWh）
     */
    private Double declaredCapacity;
    /**
     * 关联的卖方ID，纯买方为空
     */
    private String providerId;
    /**
     * 钱包余额
     */
    private Double balance;
    private VerificationQuality verificationQuality;
    private LocalDateTime verifiedAt;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
