package com.bilisync.domain.trigger.model.valobj;

import com.bilisync.types.enums.ConfigSourceEnum;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * 带来源信息的触发器配置，创建后不可变；变更通过替换整个条目完成。
 */
@Getter
@ToString
@EqualsAndHashCode
public class TriggerConfigEntry {

    private final TriggerConfig config;

    private final String providerName;

    private final ConfigSourceEnum source;

    private final LocalDateTime loadedAt;

    public TriggerConfigEntry(TriggerConfig config, String providerName, ConfigSourceEnum source, LocalDateTime loadedAt) {
        if (config == null || config.getId() == null) {
            throw new IllegalArgumentException("Trigger config entry requires a config with id");
        }
        this.config = config.copy();
        this.providerName = providerName;
        this.source = source == null ? config.getSource() : source;
        this.loadedAt = loadedAt == null ? LocalDateTime.now() : loadedAt;
    }

    public static TriggerConfigEntry of(TriggerConfig config, String providerName) {
        return new TriggerConfigEntry(config, providerName, config == null ? null : config.getSource(), LocalDateTime.now());
    }

    /**
     * 返回副本，调用方修改不会影响条目本身
     */
    public TriggerConfig getConfig() {
        return config.copy();
    }

    public String getId() {
        return config.getId();
    }
}
