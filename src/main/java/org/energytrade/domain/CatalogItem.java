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
@TableName("catalog_items")
public class CatalogItem {
    @TableId(type = IdType.INPUT)
    private String id;
    private String providerId;
    /**
     * 能源类型
     */
    private SourceType sourceType;
    /**
     * 申报可供电量（kWh），仅作描述
     */
    private Double availableQty;
    /**
     * 发电时段，JSON数组 [{startTime,endTime}]
     */
    private String productionWindowsJson;
    /**
     * 电表编号
     */
    private String meterId;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
