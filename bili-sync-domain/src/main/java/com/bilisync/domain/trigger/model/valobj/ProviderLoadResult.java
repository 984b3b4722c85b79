package com.bilisync.domain.trigger.model.valobj;

import java.util.List;

/**
 * 单个配置源的加载结果
 */
public record ProviderLoadResult(String providerName, List<TriggerConfigEntry> entries, List<ConfigLoadError> errors) {

    public ProviderLoadResult {
        entries = entries == null ? List.of() : List.copyOf(entries);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ProviderLoadResult failed(String providerName, String message) {
        return new ProviderLoadResult(providerName, List.of(), List.of(ConfigLoadError.provider(providerName, message)));
    }
}
