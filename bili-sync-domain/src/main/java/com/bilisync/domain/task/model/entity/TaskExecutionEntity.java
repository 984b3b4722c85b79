package com.bilisync.domain.task.model.entity;

import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.bilisync.types.exception.InvalidTransitionException;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 任务执行记录领域实体
 * <p>
 * 一次执行对应一条记录，重试在同一条记录上累加 retryCount。
 * 状态流转见 {@link TaskExecutionStatusEnum#canTransitionTo}。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Data
public class TaskExecutionEntity {

    /**
     * 执行 ID (UUID)
     */
    private String id;

    /**
     * 任务名
     */
    private String taskName;

    /**
     * 触发来源
     */
    private TriggerSourceEnum triggerSource;

    /**
     * 触发器名或调用方标识
     */
    private String triggerName;

    /**
     * 输入参数
     */
    private Map<String, Object> params;

    /**
     * 状态
     */
    private TaskExecutionStatusEnum status;

    /**
     * 处理器返回值
     */
    private Object result;

    /**
     * 错误消息（最后一次）
     */
    private String error;

    /**
     * 错误类型：TaskTimeoutException / TaskCancelledException / 处理器异常类名
     */
    private String errorType;

    private Integer retryCount;

    private Integer maxRetries;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    /**
     * 耗时 (毫秒)，finishedAt - startedAt
     */
    private Long durationMs;

    private LocalDateTime updatedAt;

    public static TaskExecutionEntity pending(String id,
                                              String taskName,
                                              Map<String, Object> params,
                                              TriggerSourceEnum triggerSource,
                                              String triggerName,
                                              int maxRetries) {
        LocalDateTime now = LocalDateTime.now();
        TaskExecutionEntity entity = new TaskExecutionEntity();
        entity.setId(id);
        entity.setTaskName(taskName);
        entity.setParams(params == null ? new HashMap<>() : new HashMap<>(params));
        entity.setTriggerSource(triggerSource == null ? TriggerSourceEnum.MANUAL : triggerSource);
        entity.setTriggerName(triggerName);
        entity.setStatus(TaskExecutionStatusEnum.PENDING);
        entity.setRetryCount(0);
        entity.setMaxRetries(maxRetries);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 校验并应用状态流转，失败时实体保持不变。
     */
    public void transitionTo(TaskExecutionStatusEnum target, LocalDateTime now) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new InvalidTransitionException("Invalid execution status transition. executionId=" + id
                    + ", from=" + (status == null ? null : status.getCode())
                    + ", to=" + (target == null ? null : target.getCode()));
        }
        this.status = target;
        this.updatedAt = now;
        if (target == TaskExecutionStatusEnum.RUNNING) {
            this.startedAt = now;
            return;
        }
        this.finishedAt = now;
        if (startedAt != null) {
            this.durationMs = Duration.between(startedAt, now).toMillis();
        }
    }

    /**
     * 记录一次失败重试
     */
    public void recordRetry(String error, String errorType, LocalDateTime now) {
        if (status != TaskExecutionStatusEnum.RUNNING) {
            throw new InvalidTransitionException("Retry can only be recorded on running execution. executionId="
                    + id + ", status=" + (status == null ? null : status.getCode()));
        }
        this.retryCount = (retryCount == null ? 0 : retryCount) + 1;
        this.error = error;
        this.errorType = errorType;
        this.updatedAt = now;
    }

    public boolean isRunning() {
        return status == TaskExecutionStatusEnum.RUNNING;
    }

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public TaskExecutionEntity copy() {
        TaskExecutionEntity copy = new TaskExecutionEntity();
        copy.setId(id);
        copy.setTaskName(taskName);
        copy.setTriggerSource(triggerSource);
        copy.setTriggerName(triggerName);
        copy.setParams(params == null ? null : new HashMap<>(params));
        copy.setStatus(status);
        copy.setResult(result);
        copy.setError(error);
        copy.setErrorType(errorType);
        copy.setRetryCount(retryCount);
        copy.setMaxRetries(maxRetries);
        copy.setCreatedAt(createdAt);
        copy.setStartedAt(startedAt);
        copy.setFinishedAt(finishedAt);
        copy.setDurationMs(durationMs);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
