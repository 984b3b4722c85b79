package com.bilisync.domain.trigger.service.provider;

import com.bilisync.domain.trigger.adapter.provider.IConfigChangeNotifiable;
import com.bilisync.domain.trigger.adapter.provider.ITriggerConfigProvider;
import com.bilisync.domain.trigger.adapter.repository.ICronTriggerRepository;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.types.enums.ConfigChangeTypeEnum;
import com.bilisync.types.enums.ConfigSourceEnum;
import com.bilisync.types.exception.ProviderLoadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 数据库来源：读取 source=database 的 cron_trigger 记录，并把增删改写回表中。
 */
@Slf4j
@Service
public class DatabaseTriggerConfigProvider implements ITriggerConfigProvider, IConfigChangeNotifiable {

    public static final String PROVIDER_NAME = "database";

    private final ICronTriggerRepository cronTriggerRepository;

    public DatabaseTriggerConfigProvider(ICronTriggerRepository cronTriggerRepository) {
        this.cronTriggerRepository = cronTriggerRepository;
    }

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public ConfigSourceEnum getSource() {
        return ConfigSourceEnum.DATABASE;
    }

    @Override
    public List<TriggerConfig> load() {
        List<TriggerConfig> rows;
        try {
            rows = cronTriggerRepository.findBySource(ConfigSourceEnum.DATABASE);
        } catch (RuntimeException ex) {
            throw new ProviderLoadException("Failed to query cron triggers. error=" + ex.getMessage(), ex);
        }
        List<TriggerConfig> configs = new ArrayList<>();
        if (rows == null) {
            return configs;
        }
        for (TriggerConfig row : rows) {
            if (row == null || StringUtils.isBlank(row.getId())) {
                log.warn("Skip cron trigger row without id. name={}", row == null ? null : row.getName());
                continue;
            }
            TriggerConfig config = row.copy();
            config.setSource(ConfigSourceEnum.DATABASE);
            configs.add(config);
        }
        return configs;
    }

    @Override
    public void onConfigChanged(ConfigChangeTypeEnum type, TriggerConfigEntry entry) {
        if (type == null || entry == null) {
            return;
        }
        TriggerConfig config = entry.getConfig();
        LocalDateTime now = LocalDateTime.now();
        switch (type) {
            case ADD -> {
                config.setSource(ConfigSourceEnum.DATABASE);
                if (config.getCreatedAt() == null) {
                    config.setCreatedAt(now);
                }
                config.setUpdatedAt(now);
                cronTriggerRepository.insert(config);
                log.info("Cron trigger persisted. configId={}, name={}", config.getId(), config.getName());
            }
            case UPDATE -> {
                config.setUpdatedAt(now);
                if (!cronTriggerRepository.update(config)) {
                    log.warn("Cron trigger update matched no row. configId={}", config.getId());
                }
            }
            case DELETE -> {
                if (!cronTriggerRepository.deleteById(config.getId())) {
                    log.warn("Cron trigger delete matched no row. configId={}", config.getId());
                }
            }
            default -> log.debug("Ignore config change. type={}, configId={}", type, config.getId());
        }
    }
}
