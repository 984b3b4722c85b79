package com.bilisync.infrastructure.dao.po;

import lombok.Data;

/**
 * 执行统计聚合结果
 */
@Data
public class TaskExecutionStatsPO {

    private Long total;

    private Long pending;

    private Long running;

    private Long succeeded;

    private Long failed;

    private Long cancelled;

    private Long avgDurationMs;
}
