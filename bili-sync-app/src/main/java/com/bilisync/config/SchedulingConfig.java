package com.bilisync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * 调度器隔离配置：
 * 1) cronTriggerScheduler 只承载 cron 触发器的定时回调；
 * 2) daemonScheduler 承载配置文件热加载等守护任务，同时作为 @Scheduled 的默认调度器（taskScheduler）。
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean(name = "cronTriggerScheduler")
    public ThreadPoolTaskScheduler cronTriggerScheduler(
            @Value("${trigger.scheduler.pool-size:2}") int poolSize,
            @Value("${trigger.scheduler.thread-name-prefix:cron-trigger-}") String threadNamePrefix,
            @Value("${trigger.scheduler.await-termination-seconds:10}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, threadNamePrefix, awaitTerminationSeconds);
    }

    @Bean(name = {"daemonScheduler", "taskScheduler"})
    public ThreadPoolTaskScheduler daemonScheduler(
            @Value("${scheduling.daemon.pool-size:1}") int poolSize,
            @Value("${scheduling.daemon.thread-name-prefix:daemon-scheduler-}") String threadNamePrefix,
            @Value("${scheduling.daemon.await-termination-seconds:10}") int awaitTerminationSeconds) {
        return buildScheduler(poolSize, threadNamePrefix, awaitTerminationSeconds);
    }

    private ThreadPoolTaskScheduler buildScheduler(int poolSize, String threadNamePrefix, int awaitTerminationSeconds) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(poolSize, 1));
        scheduler.setThreadNamePrefix(threadNamePrefix);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(Math.max(awaitTerminationSeconds, 0));
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setErrorHandler(throwable ->
                log.error("Scheduled task execution failed. scheduler={}, error={}",
                        threadNamePrefix, throwable.getMessage(), throwable));
        return scheduler;
    }
}
