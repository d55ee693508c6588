package org.energytrade.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("providers")
public class Provider {
    /**
     * 卖方ID（由卖方系统同步）
     */
    @TableId(type = IdType.INPUT)
    private String id;
    /**
     * 卖方名称
     */
    private String name;
    /**
     * 信任分 [0,1]，只由信任引擎修改
     */
    private Double trustScore;
    /**
     * 已结算订单数
     */
    private Integer totalOrders;
    /**
     * 足额交付订单数
     */
    private Integer successfulOrders;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
