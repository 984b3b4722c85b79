package com.bilisync.domain.task.service;

import com.bilisync.domain.task.adapter.repository.ITaskExecutionRepository;
import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.CancelResult;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.domain.task.model.valobj.ExecutionPayload;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.types.common.Constants;
import com.bilisync.types.common.PageResult;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.bilisync.types.exception.AppException;
import com.bilisync.types.exception.ExecutionNotFoundException;
import com.bilisync.types.exception.NotRunningException;
import com.google.common.cache.Cache;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;

/**
 * 执行记录追踪服务。
 * <p>
 * 执行状态的唯一写入方：每次变更都在该执行的锁内完成（读取、校验、写回），
 * 因此读方不会看到状态与结果不一致的中间态。本进程内已创建、尚未结束的执行
 * 持有一个 {@link CancellationSignal}，取消操作只触发信号，由执行器在处理器
 * 响应后写入 cancelled。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class ExecutionTracker {

    private static final String ALL_TASKS_KEY = "*";

    private final ITaskExecutionRepository taskExecutionRepository;
    private final Cache<String, TaskExecutionStats> statsCache;
    private final Striped<Lock> locks = Striped.lazyWeakLock(64);
    private final Map<String, LiveExecution> liveExecutions = new ConcurrentHashMap<>();

    public ExecutionTracker(ITaskExecutionRepository taskExecutionRepository,
                            @Qualifier("executionStatsCache") Cache<String, TaskExecutionStats> statsCache) {
        this.taskExecutionRepository = taskExecutionRepository;
        this.statsCache = statsCache;
    }

    public TaskExecutionEntity create(String taskName,
                                      Map<String, Object> params,
                                      TriggerSourceEnum triggerSource,
                                      String triggerName,
                                      int maxRetries) {
        String id = UUID.randomUUID().toString();
        TaskExecutionEntity entity = TaskExecutionEntity.pending(id, taskName, params, triggerSource, triggerName, maxRetries);
        liveExecutions.put(id, new LiveExecution(taskName, entity.getCreatedAt(), new CancellationSignal()));
        try {
            taskExecutionRepository.insert(entity);
        } catch (RuntimeException ex) {
            liveExecutions.remove(id);
            throw ex;
        }
        statsCache.invalidateAll();
        log.debug("Task execution created. executionId={}, taskName={}, triggerSource={}, triggerName={}",
                id, taskName, entity.getTriggerSource().getCode(), triggerName);
        return entity.copy();
    }

    /**
     * 按状态图推进执行状态，非法流转抛出
     * {@link com.bilisync.types.exception.InvalidTransitionException} 且不修改任何状态。
     */
    public TaskExecutionEntity transition(String id, TaskExecutionStatusEnum status, ExecutionPayload payload) {
        Lock lock = locks.get(id);
        lock.lock();
        try {
            TaskExecutionEntity entity = requireExisting(id);
            entity.transitionTo(status, LocalDateTime.now());
            if (payload != null && status.isTerminal()) {
                entity.setResult(payload.getResult());
                if (payload.getError() != null || status != TaskExecutionStatusEnum.SUCCEEDED) {
                    entity.setError(payload.getError());
                    entity.setErrorType(payload.getErrorType());
                } else {
                    entity.setError(null);
                    entity.setErrorType(null);
                }
            }
            taskExecutionRepository.update(entity);
            if (status.isTerminal()) {
                liveExecutions.remove(id);
                statsCache.invalidateAll();
            }
            return entity.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 在同一条执行上累加重试次数并保留最后一次错误
     */
    public TaskExecutionEntity recordRetry(String id, String error, String errorType) {
        Lock lock = locks.get(id);
        lock.lock();
        try {
            TaskExecutionEntity entity = requireExisting(id);
            entity.recordRetry(error, errorType, LocalDateTime.now());
            taskExecutionRepository.update(entity);
            return entity.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 不存在返回 null
     */
    public TaskExecutionEntity get(String id) {
        if (id == null) {
            return null;
        }
        Lock lock = locks.get(id);
        lock.lock();
        try {
            return taskExecutionRepository.findById(id);
        } finally {
            lock.unlock();
        }
    }

    public TaskExecutionEntity require(String id) {
        TaskExecutionEntity entity = get(id);
        if (entity == null) {
            throw new ExecutionNotFoundException("Execution not found. executionId=" + id);
        }
        return entity;
    }

    public PageResult<TaskExecutionEntity> list(TaskExecutionQuery query) {
        TaskExecutionQuery effective = query == null ? new TaskExecutionQuery() : query;
        long total = taskExecutionRepository.countByQuery(effective);
        if (total == 0L) {
            return PageResult.empty(effective.resolvePage(), effective.resolvePageSize());
        }
        List<TaskExecutionEntity> rows = taskExecutionRepository.findByQuery(effective);
        return PageResult.of(rows, total, effective.resolvePage(), effective.resolvePageSize());
    }

    /**
     * 本进程内正在运行的执行，按创建时间排序
     */
    public List<TaskExecutionEntity> running() {
        return loadRunning(liveIds(null));
    }

    public List<TaskExecutionEntity> runningByTaskName(String taskName) {
        return loadRunning(liveIds(taskName));
    }

    /**
     * 本进程内正在运行的单个执行，否则返回 null
     */
    public TaskExecutionEntity getRunning(String id) {
        if (id == null || !liveExecutions.containsKey(id)) {
            return null;
        }
        TaskExecutionEntity entity = get(id);
        return entity != null && entity.isRunning() ? entity : null;
    }

    /**
     * 执行器获取该执行的取消信号；执行已结束或不在本进程时返回 null
     */
    public CancellationSignal signalOf(String id) {
        LiveExecution live = id == null ? null : liveExecutions.get(id);
        return live == null ? null : live.signal();
    }

    /**
     * 请求取消单个执行。执行不存在抛出 {@link ExecutionNotFoundException}；
     * 非 running 或已请求过取消抛出 {@link NotRunningException}。
     */
    public TaskExecutionEntity cancel(String id) {
        Lock lock = locks.get(id);
        lock.lock();
        try {
            TaskExecutionEntity entity = requireExisting(id);
            LiveExecution live = liveExecutions.get(id);
            if (!entity.isRunning() || live == null) {
                throw new NotRunningException("Execution is not running. executionId=" + id
                        + ", status=" + entity.getStatus().getCode());
            }
            if (!live.signal().cancel(CancellationSignal.Reason.CALLER)) {
                throw new NotRunningException("Execution cancellation already requested. executionId=" + id);
            }
            log.info("Task execution cancel requested. executionId={}, taskName={}", id, entity.getTaskName());
            return entity.copy();
        } finally {
            lock.unlock();
        }
    }

    public CancelResult cancelByIds(Collection<String> ids) {
        CancelResult result = new CancelResult();
        if (ids == null) {
            return result;
        }
        for (String id : new LinkedHashSet<>(ids)) {
            cancelInto(id, result);
        }
        return result;
    }

    public CancelResult cancelByTaskName(String taskName) {
        return cancelByTaskNames(taskName == null ? List.of() : Arrays.asList(taskName));
    }

    /**
     * 没有运行中执行的任务名记入 notFound
     */
    public CancelResult cancelByTaskNames(Collection<String> taskNames) {
        CancelResult result = new CancelResult();
        if (taskNames == null) {
            return result;
        }
        for (String taskName : new LinkedHashSet<>(taskNames)) {
            List<String> ids = liveIds(taskName);
            if (ids.isEmpty()) {
                result.addNotFound(taskName);
                continue;
            }
            for (String id : ids) {
                cancelInto(id, result);
            }
        }
        return result;
    }

    public CancelResult cancelAll() {
        CancelResult result = new CancelResult();
        for (String id : liveIds(null)) {
            cancelInto(id, result);
        }
        return result;
    }

    /**
     * 统计结果缓存 3 秒
     */
    public TaskExecutionStats stats(String taskName) {
        String key = taskName == null || taskName.isBlank() ? ALL_TASKS_KEY : taskName;
        try {
            return statsCache.get(key, () -> {
                TaskExecutionStats stats = taskExecutionRepository.stats(ALL_TASKS_KEY.equals(key) ? null : key);
                return stats == null ? TaskExecutionStats.builder().taskName(taskName).build() : stats;
            });
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Failed to load execution stats. taskName=" + taskName, cause);
        }
    }

    /**
     * 将上一个进程遗留的 pending/running 执行标记为 failed。
     *
     * @return 处理数量
     */
    public int recoverOrphans() {
        List<TaskExecutionEntity> stale = taskExecutionRepository.findByStatuses(
                List.of(TaskExecutionStatusEnum.PENDING, TaskExecutionStatusEnum.RUNNING));
        if (stale == null || stale.isEmpty()) {
            return 0;
        }
        int recovered = 0;
        for (TaskExecutionEntity candidate : stale) {
            if (candidate == null || liveExecutions.containsKey(candidate.getId())) {
                continue;
            }
            Lock lock = locks.get(candidate.getId());
            lock.lock();
            try {
                TaskExecutionEntity entity = taskExecutionRepository.findById(candidate.getId());
                if (entity == null || entity.isTerminal()) {
                    continue;
                }
                LocalDateTime now = LocalDateTime.now();
                if (entity.getStatus() == TaskExecutionStatusEnum.PENDING) {
                    entity.transitionTo(TaskExecutionStatusEnum.RUNNING, now);
                }
                entity.transitionTo(TaskExecutionStatusEnum.FAILED, now);
                entity.setError("Execution was interrupted by a process restart");
                entity.setErrorType(Constants.ERROR_TYPE_ORPHANED);
                taskExecutionRepository.update(entity);
                recovered++;
            } catch (RuntimeException ex) {
                log.warn("Failed to recover orphaned execution. executionId={}, error={}",
                        candidate.getId(), ex.getMessage());
            } finally {
                lock.unlock();
            }
        }
        if (recovered > 0) {
            statsCache.invalidateAll();
            log.warn("Orphaned executions marked failed. count={}", recovered);
        }
        return recovered;
    }

    private void cancelInto(String id, CancelResult result) {
        try {
            cancel(id);
            result.addCancelled(id);
        } catch (ExecutionNotFoundException ex) {
            result.addNotFound(id);
        } catch (AppException ex) {
            result.addFailed(id, ex.getInfo());
        } catch (RuntimeException ex) {
            log.warn("Failed to cancel execution. executionId={}, error={}", id, ex.getMessage());
            result.addFailed(id, ex.getMessage());
        }
    }

    private TaskExecutionEntity requireExisting(String id) {
        TaskExecutionEntity entity = id == null ? null : taskExecutionRepository.findById(id);
        if (entity == null) {
            throw new ExecutionNotFoundException("Execution not found. executionId=" + id);
        }
        return entity;
    }

    private List<String> liveIds(String taskName) {
        List<Map.Entry<String, LiveExecution>> entries = new ArrayList<>(liveExecutions.entrySet());
        entries.sort(Comparator.comparing(entry -> entry.getValue().createdAt()));
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, LiveExecution> entry : entries) {
            if (taskName == null || taskName.equals(entry.getValue().taskName())) {
                ids.add(entry.getKey());
            }
        }
        return ids;
    }

    private List<TaskExecutionEntity> loadRunning(List<String> ids) {
        List<TaskExecutionEntity> running = new ArrayList<>();
        for (String id : ids) {
            TaskExecutionEntity entity = get(id);
            if (entity != null && entity.isRunning()) {
                running.add(entity);
            }
        }
        return running;
    }

    private record LiveExecution(String taskName, LocalDateTime createdAt, CancellationSignal signal) {
    }
}
