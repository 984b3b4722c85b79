package com.bilisync.domain.task.adapter.repository;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.types.enums.TaskExecutionStatusEnum;

import java.util.List;

/**
 * 任务执行记录仓储接口
 *
 * @author bilisync
 * @since 2025-06-02
 */
public interface ITaskExecutionRepository {

    /**
     * 新增执行记录
     */
    TaskExecutionEntity insert(TaskExecutionEntity entity);

    /**
     * 按 ID 全量更新
     */
    void update(TaskExecutionEntity entity);

    /**
     * 根据 ID 查询，不存在返回 null
     */
    TaskExecutionEntity findById(String id);

    /**
     * 条件分页查询，按 createdAt 倒序
     */
    List<TaskExecutionEntity> findByQuery(TaskExecutionQuery query);

    long countByQuery(TaskExecutionQuery query);

    /**
     * 查询指定状态的执行
     */
    List<TaskExecutionEntity> findByStatuses(List<TaskExecutionStatusEnum> statuses);

    /**
     * 统计，taskName 为空时统计全部
     */
    TaskExecutionStats stats(String taskName);
}
