package com.bilisync.api.dto;

import lombok.Data;

/**
 * 执行统计 DTO。
 */
@Data
public class TaskExecutionStatsDTO {

    private String taskName;
    private Long total;
    private Long pending;
    private Long running;
    private Long succeeded;
    private Long failed;
    private Long cancelled;
    private Long avgDurationMs;
}
