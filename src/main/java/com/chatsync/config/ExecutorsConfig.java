package com.chatsync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(DbExecutorProperties.class)
public class ExecutorsConfig {

    @Bean("chatDbExecutor")
    public Executor chatDbExecutor(DbExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("chat-db-");
        executor.setCorePoolSize(props.corePoolSizeEffective());
        executor.setMaxPoolSize(props.maxPoolSizeEffective());
        executor.setQueueCapacity(props.queueCapacityEffective());
        // 队列打满直接拒绝，由调用方回 ERROR 帧，不在 eventLoop 上回退执行
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
