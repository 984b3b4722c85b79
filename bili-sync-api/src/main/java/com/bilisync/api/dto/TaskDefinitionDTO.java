package com.bilisync.api.dto;

import lombok.Data;

import java.util.Map;

/**
 * 已注册任务 DTO。
 */
@Data
public class TaskDefinitionDTO {

    private String name;
    private String description;
    /** 超时 (毫秒)，0 表示不限 */
    private Long timeoutMs;
    private Integer maxRetries;
    private Map<String, Object> optionSchema;
}
