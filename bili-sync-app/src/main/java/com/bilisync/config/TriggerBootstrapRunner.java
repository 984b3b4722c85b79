package com.bilisync.config;

import com.bilisync.domain.task.service.ExecutionTracker;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadError;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadResult;
import com.bilisync.domain.trigger.service.ConfigManager;
import com.bilisync.domain.trigger.service.ConfigProviderManager;
import com.bilisync.domain.trigger.service.TriggerScheduler;
import com.bilisync.domain.trigger.service.provider.DatabaseTriggerConfigProvider;
import com.bilisync.domain.trigger.service.provider.FileTriggerConfigProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时完成触发器装配：注册配置源、回收孤儿执行、加载配置并开始调度。
 */
@Slf4j
@Component
public class TriggerBootstrapRunner implements ApplicationRunner {

    private final ConfigProviderManager configProviderManager;
    private final FileTriggerConfigProvider fileTriggerConfigProvider;
    private final DatabaseTriggerConfigProvider databaseTriggerConfigProvider;
    private final ExecutionTracker executionTracker;
    private final ConfigManager configManager;
    private final TriggerScheduler triggerScheduler;
    private final boolean schedulerEnabled;

    public TriggerBootstrapRunner(ConfigProviderManager configProviderManager,
                                  FileTriggerConfigProvider fileTriggerConfigProvider,
                                  DatabaseTriggerConfigProvider databaseTriggerConfigProvider,
                                  ExecutionTracker executionTracker,
                                  ConfigManager configManager,
                                  TriggerScheduler triggerScheduler,
                                  @Value("${trigger.scheduler.enabled:true}") boolean schedulerEnabled) {
        this.configProviderManager = configProviderManager;
        this.fileTriggerConfigProvider = fileTriggerConfigProvider;
        this.databaseTriggerConfigProvider = databaseTriggerConfigProvider;
        this.executionTracker = executionTracker;
        this.configManager = configManager;
        this.triggerScheduler = triggerScheduler;
        this.schedulerEnabled = schedulerEnabled;
    }

    @Override
    public void run(ApplicationArguments args) {
        configProviderManager.registerProvider(fileTriggerConfigProvider);
        configProviderManager.registerProvider(databaseTriggerConfigProvider);

        int recovered = executionTracker.recoverOrphans();
        if (recovered > 0) {
            log.warn("Orphaned executions recovered on startup. count={}", recovered);
        }

        ConfigLoadResult loadResult = configManager.loadAndInitialize();
        for (ConfigLoadError error : loadResult.errors()) {
            log.warn("Trigger config load error. provider={}, configId={}, message={}",
                    error.providerName(), error.configId(), error.message());
        }
        for (String warning : loadResult.warnings()) {
            log.warn("Trigger config load warning. message={}", warning);
        }

        if (!schedulerEnabled) {
            log.info("Skip cron trigger scheduling because trigger.scheduler.enabled=false. configs={}",
                    configManager.getConfigCount());
            return;
        }
        TriggerScheduler.ReconcileResult result = triggerScheduler.initialize();
        log.info("Trigger bootstrap finished. configs={}, scheduled={}, providers={}",
                configManager.getConfigCount(), result.added(), configProviderManager.getProviderCount());
    }
}
