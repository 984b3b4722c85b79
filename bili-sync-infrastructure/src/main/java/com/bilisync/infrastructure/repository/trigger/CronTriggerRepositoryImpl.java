package com.bilisync.infrastructure.repository.trigger;

import com.bilisync.domain.trigger.adapter.repository.ICronTriggerRepository;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.infrastructure.dao.CronTriggerDao;
import com.bilisync.infrastructure.dao.po.CronTriggerPO;
import com.bilisync.infrastructure.util.JsonCodec;
import com.bilisync.types.enums.ConfigSourceEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * cron 触发器仓储实现类
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Repository
public class CronTriggerRepositoryImpl implements ICronTriggerRepository {

    private final CronTriggerDao cronTriggerDao;
    private final JsonCodec jsonCodec;

    public CronTriggerRepositoryImpl(CronTriggerDao cronTriggerDao, JsonCodec jsonCodec) {
        this.cronTriggerDao = cronTriggerDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<TriggerConfig> findBySource(ConfigSourceEnum source) {
        return cronTriggerDao.selectBySource(source == null ? null : source.getCode()).stream()
                .map(this::toConfig)
                .collect(Collectors.toList());
    }

    @Override
    public TriggerConfig findById(String id) {
        CronTriggerPO po = cronTriggerDao.selectById(id);
        return po != null ? toConfig(po) : null;
    }

    @Override
    public TriggerConfig insert(TriggerConfig config) {
        CronTriggerPO po = toPO(config);
        LocalDateTime now = LocalDateTime.now();
        if (po.getCreatedAt() == null) {
            po.setCreatedAt(now);
        }
        po.setUpdatedAt(now);
        cronTriggerDao.insert(po);
        return toConfig(po);
    }

    @Override
    public boolean update(TriggerConfig config) {
        CronTriggerPO po = toPO(config);
        po.setUpdatedAt(LocalDateTime.now());
        return cronTriggerDao.update(po) > 0;
    }

    @Override
    public boolean deleteById(String id) {
        return cronTriggerDao.deleteById(id) > 0;
    }

    private TriggerConfig toConfig(CronTriggerPO po) {
        Map<String, Object> params = jsonCodec.readMap(po.getParams());
        return TriggerConfig.builder()
                .id(po.getId())
                .name(po.getName())
                .taskName(po.getTaskName())
                .cron(po.getCron())
                .params(params == null ? new HashMap<>() : params)
                .enabled(po.getEnabled())
                .description(po.getDescription())
                .source(ConfigSourceEnum.fromCode(po.getSource()))
                .createdAt(po.getCreatedAt())
                .updatedAt(po.getUpdatedAt())
                .build();
    }

    private CronTriggerPO toPO(TriggerConfig config) {
        return CronTriggerPO.builder()
                .id(config.getId())
                .name(config.getName())
                .taskName(config.getTaskName())
                .cron(config.getCron())
                .params(jsonCodec.writeValue(config.getParams() == null ? new HashMap<>() : config.getParams()))
                .enabled(config.isEnabledOrDefault())
                .description(config.getDescription())
                .source(config.getSource() == null ? ConfigSourceEnum.DATABASE.getCode() : config.getSource().getCode())
                .createdAt(config.getCreatedAt())
                .updatedAt(config.getUpdatedAt())
                .build();
    }
}
