package com.bilisync.domain.task.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 执行统计：按状态计数，平均耗时只统计已结束且有耗时的执行。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionStats {

    /**
     * 统计范围，为空表示全部任务
     */
    private String taskName;

    private long total;

    private long pending;

    private long running;

    private long succeeded;

    private long failed;

    private long cancelled;

    /**
     * 平均耗时 (毫秒)，四舍五入
     */
    private long avgDurationMs;
}
