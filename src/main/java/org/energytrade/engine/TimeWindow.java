package org.energytrade.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 时间窗口（左闭右开）
 * - 供匹配引擎计算重叠度
 * - 所有时间按UTC理解
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TimeWindow {

    private LocalDateTime startTime;

    private LocalDateTime endTime;

    public static TimeWindow of(LocalDateTime startTime, LocalDateTime endTime) {
        return new TimeWindow(startTime, endTime);
    }

    /**
     * 窗口是否完整（起止时间都存在）
     */
    @JsonIgnore
    public boolean isBounded() {
        return startTime != null && endTime != null;
    }

    /**
     * 窗口时长（秒），无效窗口返回0
     */
    public long durationSeconds() {
        if (!isBounded() || !endTime.isAfter(startTime)) {
            return 0;
        }
        return Duration.between(startTime, endTime).getSeconds();
    }

    /**
     * 两个窗口是否重叠：aStart < bEnd 且 bStart < aEnd
     */
    public boolean overlaps(TimeWindow other) {
        if (other == null || !isBounded() || !other.isBounded()) {
            return true;
        }
        return startTime.isBefore(other.endTime) && other.startTime.isBefore(endTime);
    }

    /**
     * 重叠时长（秒）
     */
    public long overlapSeconds(TimeWindow other) {
        if (other == null || !isBounded() || !other.isBounded() || !overlaps(other)) {
            return 0;
        }
        LocalDateTime start = startTime.isAfter(other.startTime) ? startTime : other.startTime;
        LocalDateTime end = endTime.isBefore(other.endTime) ? endTime : other.endTime;
        return Math.max(0, Duration.between(start, end).getSeconds());
    }
}
