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
@TableName("trust_score_history")
public class TrustScoreHistory {
    @TableId(type = IdType.AUTO)
    private Long id;
    private TrustSubjectType subjectType;
    private String subjectId;
    private Double previousScore;
    private Double newScore;
    private Integer previousLimit;
    private Integer newLimit;
    private Double trustImpact;
    private TrustChangeReason reason;
    private String orderId;
    private LocalDateTime createTime;
}
