package com.bilisync.domain.trigger.adapter.gateway;

import java.io.IOException;
import java.util.List;

/**
 * 触发器配置文件读取
 */
public interface ITriggerConfigFileReader {

    /**
     * 读取文件中的 JSON 数组，元素保持原始结构（对象为 Map，其它为对应的基础类型）。
     *
     * @throws IOException 文件不存在、不可读或顶层不是数组
     */
    List<Object> readItems(String location) throws IOException;

    /**
     * 文件最后修改时间（毫秒），无法获取时返回 -1
     */
    long lastModified(String location);

}
