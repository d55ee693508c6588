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
 * 入站协议消息的处理状态，供事务状态查询
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("protocol_transactions")
public class ProtocolTransaction {
    /**
     * 入站消息ID
     */
    @TableId(type = IdType.INPUT)
    private String messageId;
    private String transactionId;
    private String action;
    private ProtocolState state;
    private String errorCode;
    private String errorMessage;
    private String callbackUri;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
