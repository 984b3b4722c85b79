package com.bilisync.domain.trigger.service;

import com.bilisync.domain.trigger.model.valobj.ConfigChangeEvent;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadError;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadResult;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.types.enums.ConfigChangeTypeEnum;
import com.bilisync.types.exception.ConfigValidationException;
import com.bilisync.types.exception.TriggerNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 触发器配置存储：按 ID 持有当前生效的配置条目，接收增删改请求并向监听器广播变更事件。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class ConfigManager {

    private final ConfigLoader configLoader;
    private final ConfigProviderManager configProviderManager;
    private final TriggerConfigValidator triggerConfigValidator;
    private final Map<String, TriggerConfigEntry> configMap = new LinkedHashMap<>();
    private final List<Consumer<ConfigChangeEvent>> listeners = new CopyOnWriteArrayList<>();
    /** 变更与事件广播在同一把锁内完成，监听器看到的事件顺序与存储变更顺序一致 */
    private final Object mutationLock = new Object();

    public ConfigManager(ConfigLoader configLoader,
                         ConfigProviderManager configProviderManager,
                         TriggerConfigValidator triggerConfigValidator) {
        this.configLoader = configLoader;
        this.configProviderManager = configProviderManager;
        this.triggerConfigValidator = triggerConfigValidator;
    }

    /**
     * 从全部配置源重新加载并替换当前配置，广播 reload 事件。
     * ID 冲突记入返回结果的 errors，后出现的条目被跳过。
     */
    public ConfigLoadResult loadAndInitialize() {
        ConfigLoadResult loadResult = configLoader.loadFromAllProviders();
        List<ConfigLoadError> conflicts = initialize(loadResult.allEntries());
        if (conflicts.isEmpty()) {
            return loadResult;
        }
        List<ConfigLoadError> errors = new ArrayList<>(loadResult.errors());
        errors.addAll(conflicts);
        return new ConfigLoadResult(loadResult.allEntries(), errors, loadResult.warnings());
    }

    public List<ConfigLoadError> initialize(List<TriggerConfigEntry> entries) {
        synchronized (mutationLock) {
            return doInitialize(entries);
        }
    }

    private List<ConfigLoadError> doInitialize(List<TriggerConfigEntry> entries) {
        List<ConfigLoadError> conflicts = new ArrayList<>();
        List<TriggerConfigEntry> snapshot;
        synchronized (configMap) {
            configMap.clear();
            if (entries != null) {
                for (TriggerConfigEntry entry : entries) {
                    TriggerConfigEntry existing = configMap.get(entry.getId());
                    if (existing != null) {
                        String message = "Trigger config id conflict, later entry skipped. configId=" + entry.getId()
                                + ", kept=" + existing.getProviderName() + ", skipped=" + entry.getProviderName();
                        log.warn(message);
                        conflicts.add(ConfigLoadError.entry(entry.getProviderName(), entry.getId(), message));
                        continue;
                    }
                    configMap.put(entry.getId(), entry);
                }
            }
            snapshot = new ArrayList<>(configMap.values());
        }
        log.info("Trigger config store initialized. count={}, conflicts={}", snapshot.size(), conflicts.size());
        emit(new ConfigChangeEvent(ConfigChangeTypeEnum.RELOAD, snapshot));
        return conflicts;
    }

    /**
     * 新增配置，ID 已存在时抛出 {@link ConfigValidationException}
     */
    public TriggerConfigEntry addConfig(TriggerConfigEntry entry) {
        TriggerConfigEntry validated = revalidate(entry);
        synchronized (mutationLock) {
            synchronized (configMap) {
                TriggerConfigEntry existing = configMap.get(validated.getId());
                if (existing != null) {
                    throw new ConfigValidationException("Trigger config id already exists. configId=" + validated.getId()
                            + ", provider=" + existing.getProviderName());
                }
                configMap.put(validated.getId(), validated);
            }
            log.info("Trigger config added. configId={}, name={}, source={}",
                    validated.getId(), validated.getConfig().getName(), validated.getSource().getCode());
            publish(ConfigChangeTypeEnum.ADD, validated);
        }
        return validated;
    }

    /**
     * 替换已有配置，不存在时抛出 {@link TriggerNotFoundException}
     */
    public TriggerConfigEntry updateConfig(TriggerConfigEntry entry) {
        TriggerConfigEntry validated = revalidate(entry);
        synchronized (mutationLock) {
            synchronized (configMap) {
                if (!configMap.containsKey(validated.getId())) {
                    throw new TriggerNotFoundException("Trigger config not found. configId=" + validated.getId());
                }
                configMap.put(validated.getId(), validated);
            }
            log.info("Trigger config updated. configId={}, name={}", validated.getId(), validated.getConfig().getName());
            publish(ConfigChangeTypeEnum.UPDATE, validated);
        }
        return validated;
    }

    public TriggerConfigEntry deleteConfig(String id) {
        synchronized (mutationLock) {
            TriggerConfigEntry removed;
            synchronized (configMap) {
                removed = id == null ? null : configMap.remove(id);
            }
            if (removed == null) {
                throw new TriggerNotFoundException("Trigger config not found. configId=" + id);
            }
            log.info("Trigger config deleted. configId={}, name={}", id, removed.getConfig().getName());
            publish(ConfigChangeTypeEnum.DELETE, removed);
            return removed;
        }
    }

    /**
     * 不存在返回 null
     */
    public TriggerConfigEntry getConfigEntry(String id) {
        synchronized (configMap) {
            return id == null ? null : configMap.get(id);
        }
    }

    public List<TriggerConfig> getLoadedConfigs() {
        List<TriggerConfig> configs = new ArrayList<>();
        for (TriggerConfigEntry entry : getLoadedConfigEntries()) {
            configs.add(entry.getConfig());
        }
        return configs;
    }

    public List<TriggerConfigEntry> getLoadedConfigEntries() {
        synchronized (configMap) {
            return new ArrayList<>(configMap.values());
        }
    }

    public int getConfigCount() {
        synchronized (configMap) {
            return configMap.size();
        }
    }

    /**
     * 订阅变更事件，返回值用于取消订阅
     */
    public Runnable addListener(Consumer<ConfigChangeEvent> listener) {
        listeners.add(listener);
        log.debug("Config change listener added. listeners={}", listeners.size());
        return () -> {
            listeners.remove(listener);
            log.debug("Config change listener removed. listeners={}", listeners.size());
        };
    }

    private TriggerConfigEntry revalidate(TriggerConfigEntry entry) {
        if (entry == null) {
            throw new ConfigValidationException("Trigger config entry cannot be null");
        }
        TriggerConfig valid = triggerConfigValidator.validate(entry.getConfig());
        return new TriggerConfigEntry(valid, entry.getProviderName(), entry.getSource(), entry.getLoadedAt());
    }

    private void publish(ConfigChangeTypeEnum type, TriggerConfigEntry entry) {
        configProviderManager.notifyConfigChanged(type, entry);
        emit(ConfigChangeEvent.of(type, entry));
    }

    private void emit(ConfigChangeEvent event) {
        for (Consumer<ConfigChangeEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (RuntimeException ex) {
                log.error("Config change listener failed. type={}, error={}", event.type(), ex.getMessage(), ex);
            }
        }
    }
}
