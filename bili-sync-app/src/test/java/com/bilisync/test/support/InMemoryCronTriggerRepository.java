package com.bilisync.test.support;

import com.bilisync.domain.trigger.adapter.repository.ICronTriggerRepository;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.types.enums.ConfigSourceEnum;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 内存 cron 触发器仓储。
 */
public class InMemoryCronTriggerRepository implements ICronTriggerRepository {

    private final Map<String, TriggerConfig> store = new LinkedHashMap<>();

    @Override
    public synchronized List<TriggerConfig> findBySource(ConfigSourceEnum source) {
        return store.values().stream()
                .filter(item -> source == item.getSource())
                .map(TriggerConfig::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized TriggerConfig findById(String id) {
        TriggerConfig config = store.get(id);
        return config == null ? null : config.copy();
    }

    @Override
    public synchronized TriggerConfig insert(TriggerConfig config) {
        store.put(config.getId(), config.copy());
        return config.copy();
    }

    @Override
    public synchronized boolean update(TriggerConfig config) {
        if (!store.containsKey(config.getId())) {
            return false;
        }
        store.put(config.getId(), config.copy());
        return true;
    }

    @Override
    public synchronized boolean deleteById(String id) {
        return store.remove(id) != null;
    }

    public synchronized int size() {
        return store.size();
    }
}
