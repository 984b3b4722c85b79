package com.bilisync.domain.trigger.adapter.provider;

import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.types.enums.ConfigChangeTypeEnum;

/**
 * 配置源可选能力：接收来自本配置源之外的配置变更。
 */
public interface IConfigChangeNotifiable {

    void onConfigChanged(ConfigChangeTypeEnum type, TriggerConfigEntry entry);

}
