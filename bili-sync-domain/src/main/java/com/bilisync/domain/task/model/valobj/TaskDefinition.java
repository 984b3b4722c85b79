package com.bilisync.domain.task.model.valobj;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 任务定义，注册后不可变。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Getter
@ToString(exclude = "handler")
public class TaskDefinition {

    /**
     * 任务名，注册表内唯一
     */
    private final String name;

    private final String description;

    /**
     * 单次调用超时，{@link Duration#ZERO} 表示不限制
     */
    private final Duration timeout;

    /**
     * 最大重试次数（不含首次调用）
     */
    private final int maxRetries;

    /**
     * 参数说明，仅用于展示
     */
    private final Map<String, Object> optionSchema;

    private final TaskHandler handler;

    @Builder
    public TaskDefinition(String name,
                          String description,
                          Duration timeout,
                          Integer maxRetries,
                          Map<String, Object> optionSchema,
                          TaskHandler handler) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name cannot be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Task handler cannot be null. taskName=" + name);
        }
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative. taskName=" + name);
        }
        this.name = name;
        this.description = description;
        this.timeout = timeout == null || timeout.isNegative() ? Duration.ZERO : timeout;
        this.maxRetries = maxRetries == null ? 0 : maxRetries;
        this.optionSchema = optionSchema == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(optionSchema));
        this.handler = handler;
    }

    public boolean hasTimeout() {
        return !timeout.isZero();
    }
}
