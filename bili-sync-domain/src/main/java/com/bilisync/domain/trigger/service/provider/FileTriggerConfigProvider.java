package com.bilisync.domain.trigger.service.provider;

import com.bilisync.domain.trigger.adapter.gateway.ITriggerConfigFileReader;
import com.bilisync.domain.trigger.adapter.provider.ITriggerConfigProvider;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.types.enums.ConfigSourceEnum;
import com.bilisync.types.exception.ProviderLoadException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 配置文件来源：读取 JSON 数组，只读。
 * <p>
 * 非对象元素、缺少 id 或字段类型不对的元素会被跳过并记录日志；source 固定为 config_file。
 * </p>
 */
@Slf4j
@Service
public class FileTriggerConfigProvider implements ITriggerConfigProvider {

    public static final String PROVIDER_NAME = "config_file";

    private final ITriggerConfigFileReader triggerConfigFileReader;
    private final String location;

    public FileTriggerConfigProvider(ITriggerConfigFileReader triggerConfigFileReader,
                                     @Value("${trigger.config.file:classpath:trigger.config.json}") String location) {
        this.triggerConfigFileReader = triggerConfigFileReader;
        this.location = location;
    }

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public ConfigSourceEnum getSource() {
        return ConfigSourceEnum.CONFIG_FILE;
    }

    public String getLocation() {
        return location;
    }

    @Override
    public List<TriggerConfig> load() {
        List<Object> items;
        try {
            items = triggerConfigFileReader.readItems(location);
        } catch (IOException | RuntimeException ex) {
            throw new ProviderLoadException("Failed to read trigger config file. location=" + location
                    + ", error=" + ex.getMessage(), ex);
        }
        List<TriggerConfig> configs = new ArrayList<>();
        if (items == null) {
            return configs;
        }
        for (int index = 0; index < items.size(); index++) {
            Object item = items.get(index);
            if (!(item instanceof Map<?, ?> raw)) {
                log.warn("Skip trigger config item that is not an object. location={}, index={}", location, index);
                continue;
            }
            Object id = raw.get("id");
            if (id == null || StringUtils.isBlank(String.valueOf(id))) {
                log.warn("Skip trigger config item without id. location={}, index={}, name={}", location, index, raw.get("name"));
                continue;
            }
            try {
                configs.add(toConfig(raw));
            } catch (IllegalArgumentException ex) {
                log.warn("Skip malformed trigger config item. location={}, index={}, id={}, error={}",
                        location, index, id, ex.getMessage());
            }
        }
        log.debug("Trigger config file read. location={}, items={}, accepted={}", location, items.size(), configs.size());
        return configs;
    }

    private TriggerConfig toConfig(Map<?, ?> raw) {
        return TriggerConfig.builder()
                .id(String.valueOf(raw.get("id")))
                .name(text(raw.get("name")))
                .taskName(text(raw.get("taskName")))
                .cron(text(raw.get("cron")))
                .enabled(flag(raw.get("enabled")))
                .description(text(raw.get("description")))
                .params(params(raw.get("params")))
                .source(ConfigSourceEnum.CONFIG_FILE)
                .build();
    }

    private String text(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private Boolean flag(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if ("true".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(String.valueOf(value))) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("enabled must be a boolean");
    }

    private Map<String, Object> params(Object value) {
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("params must be an object");
        }
        Map<String, Object> params = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() != null) {
                params.put(String.valueOf(entry.getKey()), entry.getValue());
            }
        }
        return params;
    }
}
