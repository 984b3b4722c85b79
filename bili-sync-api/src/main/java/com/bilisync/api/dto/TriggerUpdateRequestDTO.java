package com.bilisync.api.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.Map;

/**
 * 更新 cron 触发器请求，字段为空表示不修改。
 */
@Data
public class TriggerUpdateRequestDTO {

    private String cron;

    private Boolean enabled;

    @Size(max = 1000, message = "description must be at most 1000 characters")
    private String description;

    private Map<String, Object> params;
}
