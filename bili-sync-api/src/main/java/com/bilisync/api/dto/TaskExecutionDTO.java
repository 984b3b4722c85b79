package com.bilisync.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 任务执行记录 DTO。
 */
@Data
public class TaskExecutionDTO {

    private String id;
    private String taskName;
    private String triggerSource;
    private String triggerName;
    private Map<String, Object> params;
    private String status;
    private Object result;
    private String error;
    private String errorType;
    private Integer retryCount;
    private Integer maxRetries;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private Long durationMs;
}
