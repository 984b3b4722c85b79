package com.bilisync.trigger.job;

import com.bilisync.domain.trigger.adapter.gateway.ITriggerConfigFileReader;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadResult;
import com.bilisync.domain.trigger.service.ConfigManager;
import com.bilisync.domain.trigger.service.provider.FileTriggerConfigProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 配置文件热加载：文件修改时间变化后从全部配置源重新加载。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "trigger.config.reload", name = "enabled", havingValue = "true")
public class TriggerConfigReloadJob {

    private final ConfigManager configManager;
    private final FileTriggerConfigProvider fileTriggerConfigProvider;
    private final ITriggerConfigFileReader triggerConfigFileReader;

    private long lastModified = -1L;

    public TriggerConfigReloadJob(ConfigManager configManager,
                                  FileTriggerConfigProvider fileTriggerConfigProvider,
                                  ITriggerConfigFileReader triggerConfigFileReader) {
        this.configManager = configManager;
        this.fileTriggerConfigProvider = fileTriggerConfigProvider;
        this.triggerConfigFileReader = triggerConfigFileReader;
    }

    @Scheduled(fixedDelayString = "${trigger.config.reload.interval-ms:30000}", scheduler = "daemonScheduler")
    public void reloadIfChanged() {
        String location = fileTriggerConfigProvider.getLocation();
        long current = triggerConfigFileReader.lastModified(location);
        if (current <= 0) {
            return;
        }
        if (lastModified < 0) {
            lastModified = current;
            return;
        }
        if (current == lastModified) {
            return;
        }
        lastModified = current;
        try {
            ConfigLoadResult result = configManager.loadAndInitialize();
            log.info("Trigger config file changed, reloaded. location={}, entries={}, errors={}",
                    location, result.allEntries().size(), result.errors().size());
        } catch (RuntimeException ex) {
            log.error("Trigger config reload failed. location={}, error={}", location, ex.getMessage(), ex);
        }
    }
}
