package com.bilisync.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 手动/接口执行任务请求 DTO。
 */
@Data
public class TaskExecuteRequestDTO {

    private Map<String, Object> params;
    /** 调用方标识，可选 */
    private String triggerName;
}
