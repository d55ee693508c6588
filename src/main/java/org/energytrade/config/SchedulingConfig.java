package org.energytrade.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * 定时任务开关，测试环境关闭
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "energy-trade.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
