package com.bilisync.domain.trigger.adapter.repository;

import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.types.enums.ConfigSourceEnum;

import java.util.List;

/**
 * cron 触发器仓储接口
 *
 * @author bilisync
 * @since 2025-06-02
 */
public interface ICronTriggerRepository {

    /**
     * 按来源查询
     */
    List<TriggerConfig> findBySource(ConfigSourceEnum source);

    /**
     * 根据 ID 查询，不存在返回 null
     */
    TriggerConfig findById(String id);

    TriggerConfig insert(TriggerConfig config);

    /**
     * 更新，返回是否命中
     */
    boolean update(TriggerConfig config);

    boolean deleteById(String id);
}
