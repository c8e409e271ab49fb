package com.gridcast.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    // 每个数据源同一时刻最多一个任务，池大小只需覆盖数据源个数
    @Bean("syncExecutor")
    public ThreadPoolTaskExecutor syncExecutor(ApplicationConfig config) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(Math.max(2, config.getPerformance().getSyncCoreSize()));
        exec.setMaxPoolSize(Math.max(2, config.getPerformance().getSyncMaxSize()));
        exec.setQueueCapacity(config.getPerformance().getSyncQueueCapacity());
        exec.setThreadNamePrefix("sync-");
        exec.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        exec.initialize();
        return exec;
    }
}
