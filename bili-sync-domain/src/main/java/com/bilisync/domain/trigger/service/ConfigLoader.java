package com.bilisync.domain.trigger.service;

import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.domain.trigger.adapter.provider.ITriggerConfigProvider;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadError;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadResult;
import com.bilisync.domain.trigger.model.valobj.ProviderLoadResult;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 触发器配置加载器。
 * <p>
 * 所有配置源并发加载并等待全部结束后合并；单个配置源或单条配置的错误只记录在结果中，不向外抛出。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class ConfigLoader {

    private final ConfigProviderManager configProviderManager;
    private final TriggerConfigValidator triggerConfigValidator;
    private final TaskRegistry taskRegistry;
    private final Executor loaderExecutor;

    public ConfigLoader(ConfigProviderManager configProviderManager,
                        TriggerConfigValidator triggerConfigValidator,
                        TaskRegistry taskRegistry,
                        @Qualifier("triggerConfigLoader") Executor loaderExecutor) {
        this.configProviderManager = configProviderManager;
        this.triggerConfigValidator = triggerConfigValidator;
        this.taskRegistry = taskRegistry;
        this.loaderExecutor = loaderExecutor;
    }

    public ProviderLoadResult loadFromProvider(ITriggerConfigProvider provider) {
        String providerName = provider.getName();
        List<TriggerConfig> rawConfigs;
        try {
            rawConfigs = provider.load();
        } catch (Exception ex) {
            log.error("Trigger config provider load failed. provider={}, error={}", providerName, ex.getMessage(), ex);
            return ProviderLoadResult.failed(providerName, ex.getMessage());
        }
        if (rawConfigs == null) {
            rawConfigs = List.of();
        }
        LocalDateTime loadedAt = LocalDateTime.now();
        List<TriggerConfigEntry> entries = new ArrayList<>();
        List<ConfigLoadError> errors = new ArrayList<>();
        for (TriggerConfig raw : rawConfigs) {
            String configId = raw == null ? null : raw.getId();
            try {
                TriggerConfig valid = triggerConfigValidator.validate(raw);
                entries.add(new TriggerConfigEntry(valid, providerName, valid.getSource(), loadedAt));
            } catch (AppException ex) {
                log.warn("Drop invalid trigger config. provider={}, configId={}, error={}", providerName, configId, ex.getInfo());
                errors.add(ConfigLoadError.entry(providerName, configId == null ? "" : configId, ex.getInfo()));
            }
        }
        log.info("Trigger configs loaded from provider. provider={}, loaded={}, invalid={}",
                providerName, entries.size(), errors.size());
        return new ProviderLoadResult(providerName, entries, errors);
    }

    /**
     * 并发加载全部配置源，按注册顺序合并结果
     */
    public ConfigLoadResult loadFromAllProviders() {
        List<ITriggerConfigProvider> providers = configProviderManager.getProviders();
        List<CompletableFuture<ProviderLoadResult>> futures = new ArrayList<>(providers.size());
        for (ITriggerConfigProvider provider : providers) {
            futures.add(submitLoad(provider));
        }
        List<TriggerConfigEntry> allEntries = new ArrayList<>();
        List<ConfigLoadError> errors = new ArrayList<>();
        for (CompletableFuture<ProviderLoadResult> future : futures) {
            ProviderLoadResult result = future.join();
            allEntries.addAll(result.entries());
            errors.addAll(result.errors());
        }
        List<String> warnings = new ArrayList<>();
        for (TriggerConfigEntry entry : allEntries) {
            TriggerConfig config = entry.getConfig();
            if (!taskRegistry.has(config.getTaskName())) {
                String warning = "Trigger references unregistered task. configId=" + config.getId()
                        + ", taskName=" + config.getTaskName();
                log.warn(warning);
                warnings.add(warning);
            }
        }
        log.info("Trigger configs loaded. providers={}, entries={}, errors={}", providers.size(), allEntries.size(), errors.size());
        return new ConfigLoadResult(allEntries, errors, warnings);
    }

    private CompletableFuture<ProviderLoadResult> submitLoad(ITriggerConfigProvider provider) {
        try {
            return CompletableFuture.supplyAsync(() -> loadFromProvider(provider), loaderExecutor)
                    .exceptionally(ex -> ProviderLoadResult.failed(provider.getName(), ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Trigger config provider load could not be dispatched. provider={}, error={}",
                    provider.getName(), ex.getMessage());
            return CompletableFuture.completedFuture(ProviderLoadResult.failed(provider.getName(), ex.getMessage()));
        }
    }
}
