package com.bilisync.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * cron 触发器 PO
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronTriggerPO {

    private String id;

    private String name;

    private String taskName;

    private String cron;

    /**
     * 任务参数 (JSONB)
     */
    private String params;

    private Boolean enabled;

    private String description;

    /**
     * config_file / database
     */
    private String source;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
