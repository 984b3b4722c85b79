package com.bilisync.domain.trigger.service;

import com.bilisync.domain.trigger.adapter.provider.IConfigChangeNotifiable;
import com.bilisync.domain.trigger.adapter.provider.ITriggerConfigProvider;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.types.enums.ConfigChangeTypeEnum;
import com.bilisync.types.enums.ConfigSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 配置源注册与变更分发。
 * <p>
 * 每种来源只保留一个配置源，重复注册时后者生效并保留原有顺序。
 * 变更通知异步投递给条目来源对应的配置源，失败只记录日志。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class ConfigProviderManager {

    private final Map<ConfigSourceEnum, ITriggerConfigProvider> providers = new LinkedHashMap<>();
    private final Executor notifyExecutor;
    /** 回写按提交顺序串行执行，避免 UPDATE 落在已删除的行之后 */
    private CompletableFuture<Void> writeBackTail = CompletableFuture.completedFuture(null);

    public ConfigProviderManager(@Qualifier("triggerConfigLoader") Executor notifyExecutor) {
        this.notifyExecutor = notifyExecutor;
    }

    public synchronized void registerProvider(ITriggerConfigProvider provider) {
        if (provider == null || provider.getSource() == null) {
            throw new IllegalArgumentException("Provider and its source cannot be null");
        }
        ITriggerConfigProvider previous = providers.put(provider.getSource(), provider);
        if (previous != null && previous != provider) {
            log.warn("Trigger config provider replaced. source={}, previous={}, current={}",
                    provider.getSource().getCode(), previous.getName(), provider.getName());
            return;
        }
        log.info("Trigger config provider registered. source={}, name={}, notifiable={}",
                provider.getSource().getCode(), provider.getName(), provider instanceof IConfigChangeNotifiable);
    }

    /**
     * 按注册顺序返回
     */
    public synchronized List<ITriggerConfigProvider> getProviders() {
        return new ArrayList<>(providers.values());
    }

    public synchronized ITriggerConfigProvider getProvider(ConfigSourceEnum source) {
        return source == null ? null : providers.get(source);
    }

    public synchronized boolean hasProvider(ConfigSourceEnum source) {
        return source != null && providers.containsKey(source);
    }

    public synchronized int getProviderCount() {
        return providers.size();
    }

    /**
     * 投递变更通知。返回的 future 总是正常完成，便于调用方按需等待。
     */
    public CompletableFuture<Void> notifyConfigChanged(ConfigChangeTypeEnum type, TriggerConfigEntry entry) {
        if (entry == null) {
            log.warn("Skip config change notification because entry is null. type={}", type);
            return CompletableFuture.completedFuture(null);
        }
        ITriggerConfigProvider provider = getProvider(entry.getSource());
        if (provider == null) {
            log.warn("Skip config change notification because provider is missing. type={}, configId={}, source={}",
                    type, entry.getId(), entry.getSource());
            return CompletableFuture.completedFuture(null);
        }
        if (!(provider instanceof IConfigChangeNotifiable notifiable)) {
            log.warn("Skip config change notification because provider is not notifiable. type={}, configId={}, provider={}",
                    type, entry.getId(), provider.getName());
            return CompletableFuture.completedFuture(null);
        }
        return enqueueWriteBack(() -> notifiable.onConfigChanged(type, entry), type, entry, provider.getName());
    }

    private synchronized CompletableFuture<Void> enqueueWriteBack(Runnable writeBack, ConfigChangeTypeEnum type,
                                                                  TriggerConfigEntry entry, String providerName) {
        CompletableFuture<Void> step;
        try {
            step = writeBackTail.thenRunAsync(writeBack, notifyExecutor)
                    .exceptionally(ex -> {
                        log.error("Config change notification failed. type={}, configId={}, provider={}, error={}",
                                type, entry.getId(), providerName, ex.getMessage(), ex);
                        return null;
                    });
        } catch (RuntimeException ex) {
            log.error("Config change notification could not be dispatched. type={}, configId={}, provider={}, error={}",
                    type, entry.getId(), providerName, ex.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        writeBackTail = step;
        return step;
    }
}
