package com.bilisync.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * cron 触发器 DTO。
 */
@Data
public class TriggerDTO {

    private String id;
    private String name;
    private String taskName;
    private String cron;
    private Map<String, Object> params;
    private Boolean enabled;
    private String description;
    /** config_file / database */
    private String source;
    /** 调度状态：unscheduled / scheduled / paused */
    private String scheduleState;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
