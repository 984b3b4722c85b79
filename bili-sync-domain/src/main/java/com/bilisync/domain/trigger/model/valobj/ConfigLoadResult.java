package com.bilisync.domain.trigger.model.valobj;

import java.util.List;

/**
 * 全部配置源的合并加载结果，条目按配置源注册顺序排列。
 * warnings 记录不影响加载的问题，例如引用了未注册的任务。
 */
public record ConfigLoadResult(List<TriggerConfigEntry> allEntries, List<ConfigLoadError> errors, List<String> warnings) {

    public ConfigLoadResult {
        allEntries = allEntries == null ? List.of() : List.copyOf(allEntries);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
