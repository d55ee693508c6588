package org.energytrade.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 协议异步处理线程池
 * ACK之后的匹配、下单、回调投递都在这里执行
 */
@Configuration
public class AsyncConfig {

    @Bean(destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler protocolTaskScheduler(TradeProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getProtocol().getWorkerPoolSize());
        scheduler.setThreadNamePrefix("protocol-worker-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        return scheduler;
    }
}
