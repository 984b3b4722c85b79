package com.bilisync.domain.trigger.model.valobj;

/**
 * 加载错误：整个配置源失败时 configId 为空。
 */
public record ConfigLoadError(String providerName, String configId, String message) {

    public static ConfigLoadError provider(String providerName, String message) {
        return new ConfigLoadError(providerName, null, message);
    }

    public static ConfigLoadError entry(String providerName, String configId, String message) {
        return new ConfigLoadError(providerName, configId, message);
    }

    public boolean isProviderFailure() {
        return configId == null;
    }
}
