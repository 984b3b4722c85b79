package com.bilisync.domain.trigger.model.valobj;

import com.bilisync.types.enums.ConfigChangeTypeEnum;

import java.util.List;

/**
 * 配置变更事件。reload 事件携带全部当前条目，其余事件只携带受影响的单个条目。
 */
public record ConfigChangeEvent(ConfigChangeTypeEnum type, List<TriggerConfigEntry> entries) {

    public ConfigChangeEvent {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static ConfigChangeEvent of(ConfigChangeTypeEnum type, TriggerConfigEntry entry) {
        return new ConfigChangeEvent(type, entry == null ? List.of() : List.of(entry));
    }

    public TriggerConfigEntry entry() {
        return entries.isEmpty() ? null : entries.get(0);
    }
}
