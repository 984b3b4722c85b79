package com.bilisync.config;

import com.bilisync.domain.task.model.valobj.RetryBackoffPolicy;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.trigger.task.TestTask;
import com.bilisync.trigger.task.UserCardSyncTask;
import com.bilisync.trigger.task.UserSpaceSyncTask;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 任务注册与执行器重试配置。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Configuration
public class TaskRegistryConfig {

    private final TaskRegistry taskRegistry;
    private final UserCardSyncTask userCardSyncTask;
    private final UserSpaceSyncTask userSpaceSyncTask;

    public TaskRegistryConfig(TaskRegistry taskRegistry,
                              UserCardSyncTask userCardSyncTask,
                              UserSpaceSyncTask userSpaceSyncTask) {
        this.taskRegistry = taskRegistry;
        this.userCardSyncTask = userCardSyncTask;
        this.userSpaceSyncTask = userSpaceSyncTask;
    }

    @Bean
    public RetryBackoffPolicy retryBackoffPolicy(
            @Value("${task.executor.retry.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${task.executor.retry.multiplier:2.0}") double multiplier,
            @Value("${task.executor.retry.max-backoff-ms:30000}") long maxBackoffMs) {
        return new RetryBackoffPolicy(initialBackoffMs, multiplier, maxBackoffMs);
    }

    @PostConstruct
    public void registerTasks() {
        taskRegistry.register(TaskDefinition.builder()
                .name(UserCardSyncTask.TASK_NAME)
                .description("同步用户名片数据")
                .timeout(Duration.ofMinutes(5))
                .maxRetries(3)
                .optionSchema(midsSchema())
                .handler(userCardSyncTask)
                .build());
        taskRegistry.register(TaskDefinition.builder()
                .name(UserSpaceSyncTask.TASK_NAME)
                .description("同步用户空间数据")
                .timeout(Duration.ofMinutes(5))
                .maxRetries(3)
                .optionSchema(midsSchema())
                .handler(userSpaceSyncTask)
                .build());
        taskRegistry.register(TaskDefinition.builder()
                .name(TestTask.TASK_NAME)
                .description("分片休眠 60 秒，用于验证超时与取消")
                .timeout(Duration.ofSeconds(70))
                .maxRetries(0)
                .handler(new TestTask())
                .build());
        log.info("Tasks registered. count={}, names={}", taskRegistry.size(),
                taskRegistry.list().stream().map(TaskDefinition::getName).toList());
    }

    private Map<String, Object> midsSchema() {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("mids", Map.of("type", "array", "items", "long", "required", true));
        schema.put("example", Map.of("mids", List.of(2, 208259)));
        return schema;
    }
}
