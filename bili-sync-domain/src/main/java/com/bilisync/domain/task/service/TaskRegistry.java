package com.bilisync.domain.task.service;

import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.types.exception.DuplicateTaskException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 任务注册表：启动时显式注册，运行期只读，不提供删除。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class TaskRegistry {

    private final Map<String, TaskDefinition> definitions = new LinkedHashMap<>();

    /**
     * 注册任务定义，同名已存在时抛出 {@link DuplicateTaskException} 并保留原定义。
     */
    public synchronized void register(TaskDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("Task definition cannot be null");
        }
        if (definitions.containsKey(definition.getName())) {
            throw new DuplicateTaskException("Task already registered. taskName=" + definition.getName());
        }
        definitions.put(definition.getName(), definition);
        log.info("Task registered. taskName={}, timeoutMs={}, maxRetries={}",
                definition.getName(), definition.getTimeout().toMillis(), definition.getMaxRetries());
    }

    /**
     * 按名称查找，不存在返回 null
     */
    public synchronized TaskDefinition get(String name) {
        if (name == null) {
            return null;
        }
        return definitions.get(name);
    }

    public synchronized boolean has(String name) {
        return name != null && definitions.containsKey(name);
    }

    /**
     * 按注册顺序返回
     */
    public synchronized List<TaskDefinition> list() {
        return new ArrayList<>(definitions.values());
    }

    public synchronized int size() {
        return definitions.size();
    }
}
