package com.bilisync.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 触发器调度状态 DTO。
 */
@Data
public class TriggerScheduleStateDTO {

    private String triggerId;
    private String triggerName;
    private String taskName;
    private String cron;
    private Boolean enabled;
    private String state;
    private String lastExecutionId;
    private LocalDateTime lastFiredAt;
}
