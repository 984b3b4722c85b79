package com.bilisync.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 0xxx 为通用码，1xxx 为任务执行相关，2xxx 为触发器配置相关。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Getter
public enum ResponseCode {

    SUCCESS("0000", "成功"),
    UN_ERROR("0001", "未知失败"),
    ILLEGAL_PARAMETER("0002", "非法参数"),

    DUPLICATE_TASK("1001", "任务重复注册"),
    TASK_NOT_FOUND("1002", "任务不存在"),
    TASK_TIMEOUT("1003", "任务执行超时"),
    TASK_CANCELLED("1004", "任务已取消"),
    INVALID_TRANSITION("1005", "非法状态流转"),
    NOT_RUNNING("1006", "执行未在运行中"),
    EXECUTION_NOT_FOUND("1007", "执行记录不存在"),

    PROVIDER_LOAD_FAILED("2001", "配置源加载失败"),
    CONFIG_VALIDATION_FAILED("2002", "触发器配置校验失败"),
    TRIGGER_NOT_FOUND("2003", "触发器不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
