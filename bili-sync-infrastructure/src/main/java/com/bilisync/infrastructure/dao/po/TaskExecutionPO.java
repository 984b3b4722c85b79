package com.bilisync.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务执行记录 PO
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionPO {

    /**
     * 执行 ID (UUID)
     */
    private String id;

    private String taskName;

    /**
     * manual / cron / api
     */
    private String triggerSource;

    private String triggerName;

    /**
     * 输入参数 (JSONB)
     */
    private String params;

    private String status;

    /**
     * 执行结果 (JSONB)
     */
    private String result;

    private String error;

    private String errorType;

    private Integer retryCount;

    private Integer maxRetries;

    private LocalDateTime createdAt;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    private Long durationMs;

    private LocalDateTime updatedAt;
}
