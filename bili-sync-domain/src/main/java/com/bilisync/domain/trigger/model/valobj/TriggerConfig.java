package com.bilisync.domain.trigger.model.valobj;

import com.bilisync.types.enums.ConfigSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 触发器配置
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TriggerConfig {

    /**
     * 由来源分配：配置文件中的稳定 ID 或数据库主键
     */
    private String id;

    /**
     * 触发器名，1..100 字符
     */
    private String name;

    /**
     * 目标任务名，加载时不要求已注册
     */
    private String taskName;

    /**
     * cron 表达式，5 段或 6 段（含秒）
     */
    private String cron;

    private Map<String, Object> params;

    /**
     * 默认 true
     */
    private Boolean enabled;

    private String description;

    private ConfigSourceEnum source;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isEnabledOrDefault() {
        return enabled == null || enabled;
    }

    public TriggerConfig copy() {
        return toBuilder()
                .params(params == null ? null : new LinkedHashMap<>(params))
                .build();
    }
}
