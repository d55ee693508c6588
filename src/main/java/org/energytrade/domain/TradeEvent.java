package org.energytrade.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 协议消息日志（只追加）
 * (message_id, direction) 唯一，用于入站去重
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("events")
public class TradeEvent {
    @TableId(type = IdType.AUTO)
    private Long id;
    private String transactionId;
    private String messageId;
    private String action;
    private EventDirection direction;
    private String rawJson;
    private LocalDateTime createTime;
}
