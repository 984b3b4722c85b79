package com.bilisync.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

/**
 * 创建 cron 触发器请求。
 */
@Data
public class TriggerCreateRequestDTO {

    @NotBlank(message = "name is required")
    @Size(max = 100, message = "name must be at most 100 characters")
    private String name;

    @NotBlank(message = "taskName is required")
    @Size(max = 100, message = "taskName must be at most 100 characters")
    private String taskName;

    @NotBlank(message = "cron is required")
    private String cron;

    private Map<String, Object> params;

    private Boolean enabled;

    @Size(max = 1000, message = "description must be at most 1000 characters")
    private String description;
}
