package com.bilisync.domain.trigger.adapter.provider;

import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.types.enums.ConfigSourceEnum;

import java.util.List;

/**
 * 触发器配置源。
 * <p>
 * load 失败应抛出 {@link com.bilisync.types.exception.ProviderLoadException}，只影响本配置源。
 * 需要感知外部变更（例如写回数据库）的配置源另行实现 {@link IConfigChangeNotifiable}。
 * </p>
 */
public interface ITriggerConfigProvider {

    String getName();

    ConfigSourceEnum getSource();

    /**
     * 返回原始配置，校验由加载器负责
     */
    List<TriggerConfig> load();

}
