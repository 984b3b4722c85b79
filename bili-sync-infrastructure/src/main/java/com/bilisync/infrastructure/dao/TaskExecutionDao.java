package com.bilisync.infrastructure.dao;

import com.bilisync.infrastructure.dao.po.TaskExecutionPO;
import com.bilisync.infrastructure.dao.po.TaskExecutionQueryPO;
import com.bilisync.infrastructure.dao.po.TaskExecutionStatsPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务执行记录 DAO
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Mapper
public interface TaskExecutionDao {

    int insert(TaskExecutionPO po);

    /**
     * 按 ID 全量更新可变字段
     */
    int update(TaskExecutionPO po);

    TaskExecutionPO selectById(@Param("id") String id);

    /**
     * 条件分页查询，按 created_at 倒序
     */
    List<TaskExecutionPO> selectByQuery(TaskExecutionQueryPO query);

    long countByQuery(TaskExecutionQueryPO query);

    List<TaskExecutionPO> selectByStatuses(@Param("statuses") List<String> statuses);

    /**
     * 按状态聚合，taskName 为空时统计全部
     */
    TaskExecutionStatsPO selectStats(@Param("taskName") String taskName);
}
