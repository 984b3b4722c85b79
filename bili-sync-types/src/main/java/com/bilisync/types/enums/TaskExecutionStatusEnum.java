package com.bilisync.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务执行状态枚举
 * <p>
 * 状态只允许单向流转：pending -> running -> succeeded | failed | cancelled。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
public enum TaskExecutionStatusEnum {

    /**
     * 待执行 - 执行记录已创建
     */
    PENDING("pending"),

    /**
     * 运行中 - 处理器正在执行（含重试等待）
     */
    RUNNING("running"),

    /**
     * 成功
     */
    SUCCEEDED("succeeded"),

    /**
     * 失败 - 重试耗尽、超时或被判定为孤儿执行
     */
    FAILED("failed"),

    /**
     * 已取消 - 处理器响应了取消信号
     */
    CANCELLED("cancelled");

    private final String code;

    TaskExecutionStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskExecutionStatusEnum target) {
        if (target == null) {
            return false;
        }
        if (this == PENDING) {
            return target == RUNNING;
        }
        if (this == RUNNING) {
            return target.isTerminal();
        }
        return false;
    }

    public static TaskExecutionStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskExecutionStatusEnum status : TaskExecutionStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task execution status code: " + code);
    }
}
