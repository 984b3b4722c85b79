package com.bilisync.infrastructure.repository.task;

import com.bilisync.domain.task.adapter.repository.ITaskExecutionRepository;
import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.infrastructure.dao.TaskExecutionDao;
import com.bilisync.infrastructure.dao.po.TaskExecutionPO;
import com.bilisync.infrastructure.dao.po.TaskExecutionQueryPO;
import com.bilisync.infrastructure.dao.po.TaskExecutionStatsPO;
import com.bilisync.infrastructure.util.JsonCodec;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 任务执行记录仓储实现类。
 * <p>
 * 负责执行记录的持久化，params 与 result 以 JSONB 存储。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Repository
public class TaskExecutionRepositoryImpl implements ITaskExecutionRepository {

    private final TaskExecutionDao taskExecutionDao;
    private final JsonCodec jsonCodec;

    public TaskExecutionRepositoryImpl(TaskExecutionDao taskExecutionDao, JsonCodec jsonCodec) {
        this.taskExecutionDao = taskExecutionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public TaskExecutionEntity insert(TaskExecutionEntity entity) {
        taskExecutionDao.insert(toPO(entity));
        return entity.copy();
    }

    @Override
    public void update(TaskExecutionEntity entity) {
        int rows = taskExecutionDao.update(toPO(entity));
        if (rows == 0) {
            log.warn("Task execution update matched no row. executionId={}", entity.getId());
        }
    }

    @Override
    public TaskExecutionEntity findById(String id) {
        TaskExecutionPO po = taskExecutionDao.selectById(id);
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<TaskExecutionEntity> findByQuery(TaskExecutionQuery query) {
        return taskExecutionDao.selectByQuery(toQueryPO(query)).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public long countByQuery(TaskExecutionQuery query) {
        return taskExecutionDao.countByQuery(toQueryPO(query));
    }

    @Override
    public List<TaskExecutionEntity> findByStatuses(List<TaskExecutionStatusEnum> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> codes = statuses.stream().map(TaskExecutionStatusEnum::getCode).collect(Collectors.toList());
        return taskExecutionDao.selectByStatuses(codes).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public TaskExecutionStats stats(String taskName) {
        TaskExecutionStatsPO po = taskExecutionDao.selectStats(taskName);
        if (po == null) {
            return TaskExecutionStats.builder().taskName(taskName).build();
        }
        return TaskExecutionStats.builder()
                .taskName(taskName)
                .total(valueOf(po.getTotal()))
                .pending(valueOf(po.getPending()))
                .running(valueOf(po.getRunning()))
                .succeeded(valueOf(po.getSucceeded()))
                .failed(valueOf(po.getFailed()))
                .cancelled(valueOf(po.getCancelled()))
                .avgDurationMs(valueOf(po.getAvgDurationMs()))
                .build();
    }

    private TaskExecutionQueryPO toQueryPO(TaskExecutionQuery query) {
        TaskExecutionQuery safe = query == null ? new TaskExecutionQuery() : query;
        return TaskExecutionQueryPO.builder()
                .taskName(safe.getTaskName())
                .status(safe.getStatus() == null ? null : safe.getStatus().getCode())
                .triggerSource(safe.getTriggerSource() == null ? null : safe.getTriggerSource().getCode())
                .triggerName(safe.getTriggerName())
                .startedFrom(safe.getStartedFrom())
                .startedTo(safe.getStartedTo())
                .offset(safe.offset())
                .limit(safe.resolvePageSize())
                .build();
    }

    private TaskExecutionEntity toEntity(TaskExecutionPO po) {
        TaskExecutionEntity entity = new TaskExecutionEntity();
        entity.setId(po.getId());
        entity.setTaskName(po.getTaskName());
        entity.setTriggerSource(TriggerSourceEnum.fromCode(po.getTriggerSource()));
        entity.setTriggerName(po.getTriggerName());
        Map<String, Object> params = jsonCodec.readMap(po.getParams());
        entity.setParams(params == null ? new HashMap<>() : params);
        entity.setStatus(TaskExecutionStatusEnum.fromCode(po.getStatus()));
        entity.setResult(jsonCodec.readAny(po.getResult()));
        entity.setError(po.getError());
        entity.setErrorType(po.getErrorType());
        entity.setRetryCount(po.getRetryCount());
        entity.setMaxRetries(po.getMaxRetries());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setFinishedAt(po.getFinishedAt());
        entity.setDurationMs(po.getDurationMs());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private TaskExecutionPO toPO(TaskExecutionEntity entity) {
        return TaskExecutionPO.builder()
                .id(entity.getId())
                .taskName(entity.getTaskName())
                .triggerSource(entity.getTriggerSource() == null ? null : entity.getTriggerSource().getCode())
                .triggerName(entity.getTriggerName())
                .params(jsonCodec.writeValue(entity.getParams() == null ? new HashMap<>() : entity.getParams()))
                .status(entity.getStatus() == null ? null : entity.getStatus().getCode())
                .result(jsonCodec.writeValue(entity.getResult()))
                .error(entity.getError())
                .errorType(entity.getErrorType())
                .retryCount(entity.getRetryCount())
                .maxRetries(entity.getMaxRetries())
                .createdAt(entity.getCreatedAt())
                .startedAt(entity.getStartedAt())
                .finishedAt(entity.getFinishedAt())
                .durationMs(entity.getDurationMs())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private long valueOf(Long value) {
        return value == null ? 0L : value;
    }
}
