package com.bilisync.domain.task.service;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.domain.task.model.valobj.ExecutionPayload;
import com.bilisync.domain.task.model.valobj.RetryBackoffPolicy;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.bilisync.types.exception.InvalidTransitionException;
import com.bilisync.types.exception.TaskCancelledException;
import com.bilisync.types.exception.TaskNotFoundException;
import com.bilisync.types.exception.TaskTimeoutException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 任务执行器：超时、重试、协作式取消。
 * <p>
 * 每次执行的生命周期（含重试等待）运行在 taskExecutionWorker 上，处理器的每次调用
 * 运行在 taskHandlerWorker 上。超时只触发取消信号并结束执行记录，处理器线程不会被中断；
 * 不响应信号的处理器会继续运行直到自行返回，其结果被丢弃。
 * </p>
 * <ul>
 *   <li>超时：记为 failed(TaskTimeoutException)；若调用方已先行取消则记为 cancelled。超时不重试。</li>
 *   <li>处理器抛出 TaskCancelledException，或调用方取消后任何失败：记为 cancelled，不重试。</li>
 *   <li>其它异常：重试次数未用尽时在同一条执行上累加 retryCount，按退避等待后重新调用。</li>
 * </ul>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class TaskExecutor {

    private static final String METRIC_EXECUTION_TOTAL = "bili.task.execution.total";
    private static final String METRIC_EXECUTION_DURATION = "bili.task.execution.duration";

    private static final String ERROR_TYPE_TIMEOUT = TaskTimeoutException.class.getSimpleName();
    private static final String ERROR_TYPE_CANCELLED = TaskCancelledException.class.getSimpleName();

    private final TaskRegistry taskRegistry;
    private final ExecutionTracker executionTracker;
    private final ExecutorService taskExecutionWorker;
    private final ExecutorService taskHandlerWorker;
    private final RetryBackoffPolicy retryBackoffPolicy;
    private final MeterRegistry meterRegistry;

    public TaskExecutor(TaskRegistry taskRegistry,
                        ExecutionTracker executionTracker,
                        @Qualifier("taskExecutionWorker") ExecutorService taskExecutionWorker,
                        @Qualifier("taskHandlerWorker") ExecutorService taskHandlerWorker,
                        RetryBackoffPolicy retryBackoffPolicy,
                        MeterRegistry meterRegistry) {
        this.taskRegistry = taskRegistry;
        this.executionTracker = executionTracker;
        this.taskExecutionWorker = taskExecutionWorker;
        this.taskHandlerWorker = taskHandlerWorker;
        this.retryBackoffPolicy = retryBackoffPolicy == null ? RetryBackoffPolicy.defaults() : retryBackoffPolicy;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 异步启动一次执行并立即返回执行 ID。任务不存在时同步抛出 {@link TaskNotFoundException}。
     */
    public String run(String taskName, Map<String, Object> params, TriggerSourceEnum triggerSource, String triggerName) {
        return submit(taskName, params, triggerSource, triggerName).executionId();
    }

    /**
     * 启动一次执行，返回的 future 以终态执行记录完成，不会异常完成。
     */
    public CompletableFuture<TaskExecutionEntity> execute(String taskName,
                                                          Map<String, Object> params,
                                                          TriggerSourceEnum triggerSource,
                                                          String triggerName) {
        return submit(taskName, params, triggerSource, triggerName).completion();
    }

    private Submission submit(String taskName, Map<String, Object> params, TriggerSourceEnum triggerSource, String triggerName) {
        TaskDefinition definition = taskRegistry.get(taskName);
        if (definition == null) {
            throw new TaskNotFoundException("Task not found. taskName=" + taskName);
        }
        TaskExecutionEntity execution = executionTracker.create(taskName, params, triggerSource, triggerName,
                definition.getMaxRetries());
        String executionId = execution.getId();
        try {
            CompletableFuture<TaskExecutionEntity> completion = CompletableFuture.supplyAsync(
                    () -> drive(definition, execution), taskExecutionWorker);
            return new Submission(executionId, completion);
        } catch (RejectedExecutionException ex) {
            log.warn("Task execution rejected by worker pool. executionId={}, taskName={}, error={}",
                    executionId, taskName, ex.getMessage());
            executionTracker.transition(executionId, TaskExecutionStatusEnum.RUNNING, ExecutionPayload.none());
            TaskExecutionEntity failed = finish(definition, executionId, TaskExecutionStatusEnum.FAILED,
                    ExecutionPayload.error("Task execution rejected: worker pool is saturated",
                            RejectedExecutionException.class.getSimpleName()));
            return new Submission(executionId, CompletableFuture.completedFuture(failed));
        }
    }

    private TaskExecutionEntity drive(TaskDefinition definition, TaskExecutionEntity execution) {
        String executionId = execution.getId();
        try {
            CancellationSignal signal = executionTracker.signalOf(executionId);
            if (signal == null) {
                signal = new CancellationSignal();
            }
            executionTracker.transition(executionId, TaskExecutionStatusEnum.RUNNING, ExecutionPayload.none());
            log.info("Task execution started. executionId={}, taskName={}, triggerSource={}, triggerName={}",
                    executionId, definition.getName(), execution.getTriggerSource().getCode(), execution.getTriggerName());
            return runAttempts(definition, execution, signal);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("Task execution interrupted. executionId={}, taskName={}", executionId, definition.getName());
            return finish(definition, executionId, TaskExecutionStatusEnum.FAILED,
                    ExecutionPayload.error("Task execution interrupted", ex.getClass().getSimpleName()));
        } catch (RuntimeException ex) {
            log.error("Task execution bookkeeping failed. executionId={}, taskName={}, error={}",
                    executionId, definition.getName(), ex.getMessage(), ex);
            return finish(definition, executionId, TaskExecutionStatusEnum.FAILED,
                    ExecutionPayload.error(ex.getMessage(), ex.getClass().getSimpleName()));
        }
    }

    private TaskExecutionEntity runAttempts(TaskDefinition definition,
                                            TaskExecutionEntity execution,
                                            CancellationSignal signal) throws InterruptedException {
        String executionId = execution.getId();
        int retryCount = 0;
        while (true) {
            try {
                signal.throwIfCancelled();
                Object result = invokeHandler(definition, execution.getParams(), signal);
                return finish(definition, executionId, TaskExecutionStatusEnum.SUCCEEDED, ExecutionPayload.result(result));
            } catch (TaskTimeoutException ex) {
                if (signal.isCallerCancelled()) {
                    return finish(definition, executionId, TaskExecutionStatusEnum.CANCELLED,
                            ExecutionPayload.error("Task cancelled before timeout elapsed", ERROR_TYPE_CANCELLED));
                }
                return finish(definition, executionId, TaskExecutionStatusEnum.FAILED,
                        ExecutionPayload.error(ex.getMessage(), ERROR_TYPE_TIMEOUT));
            } catch (InterruptedException ex) {
                throw ex;
            } catch (Exception ex) {
                if (ex instanceof TaskCancelledException || signal.isCallerCancelled()) {
                    return finish(definition, executionId, TaskExecutionStatusEnum.CANCELLED,
                            ExecutionPayload.error(messageOf(ex), ERROR_TYPE_CANCELLED));
                }
                String errorType = ex.getClass().getSimpleName();
                if (retryCount >= definition.getMaxRetries()) {
                    log.warn("Task execution failed, retries exhausted. executionId={}, taskName={}, retryCount={}, error={}",
                            executionId, definition.getName(), retryCount, messageOf(ex));
                    return finish(definition, executionId, TaskExecutionStatusEnum.FAILED,
                            ExecutionPayload.error(messageOf(ex), errorType));
                }
                retryCount++;
                executionTracker.recordRetry(executionId, messageOf(ex), errorType);
                Duration delay = retryBackoffPolicy.delayForRetry(retryCount);
                log.warn("Task execution failed, retrying. executionId={}, taskName={}, retry={}/{}, delayMs={}, error={}",
                        executionId, definition.getName(), retryCount, definition.getMaxRetries(), delay.toMillis(),
                        messageOf(ex));
                signal.await(delay);
            }
        }
    }

    private Object invokeHandler(TaskDefinition definition,
                                 Map<String, Object> params,
                                 CancellationSignal signal) throws Exception {
        Map<String, Object> handlerParams = params == null ? new HashMap<>() : new HashMap<>(params);
        Future<Object> future = taskHandlerWorker.submit(() -> definition.getHandler().handle(handlerParams, signal));
        try {
            if (!definition.hasTimeout()) {
                return future.get();
            }
            return future.get(definition.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            signal.cancel(CancellationSignal.Reason.TIMEOUT);
            throw new TaskTimeoutException("Task execution timed out. taskName=" + definition.getName()
                    + ", timeoutMs=" + definition.getTimeout().toMillis());
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof Exception exception && !(cause instanceof InterruptedException)) {
                throw exception;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private TaskExecutionEntity finish(TaskDefinition definition,
                                       String executionId,
                                       TaskExecutionStatusEnum status,
                                       ExecutionPayload payload) {
        TaskExecutionEntity finished;
        try {
            finished = executionTracker.transition(executionId, status, payload);
        } catch (InvalidTransitionException ex) {
            log.warn("Task execution already finished elsewhere. executionId={}, target={}, error={}",
                    executionId, status.getCode(), ex.getMessage());
            return executionTracker.get(executionId);
        }
        recordMetrics(definition.getName(), finished);
        if (status == TaskExecutionStatusEnum.SUCCEEDED) {
            log.info("Task execution succeeded. executionId={}, taskName={}, retryCount={}, durationMs={}",
                    executionId, definition.getName(), finished.getRetryCount(), finished.getDurationMs());
        } else {
            log.warn("Task execution finished. executionId={}, taskName={}, status={}, errorType={}, error={}",
                    executionId, definition.getName(), status.getCode(), finished.getErrorType(), finished.getError());
        }
        return finished;
    }

    private void recordMetrics(String taskName, TaskExecutionEntity finished) {
        if (meterRegistry == null || finished == null) {
            return;
        }
        meterRegistry.counter(METRIC_EXECUTION_TOTAL, "task", taskName, "status", finished.getStatus().getCode()).increment();
        if (finished.getDurationMs() != null) {
            meterRegistry.timer(METRIC_EXECUTION_DURATION, "task", taskName)
                    .record(finished.getDurationMs(), TimeUnit.MILLISECONDS);
        }
    }

    private String messageOf(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getName() : message;
    }

    private record Submission(String executionId, CompletableFuture<TaskExecutionEntity> completion) {
    }
}
