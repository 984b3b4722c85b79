package com.bilisync.api.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 触发器重载结果 DTO。
 */
@Data
public class TriggerReloadResultDTO {

    private Integer loaded;
    private Integer added;
    private Integer removed;
    private Integer rescheduled;
    private Integer unchanged;
    private List<String> errors = new ArrayList<>();
    private List<String> warnings = new ArrayList<>();
}
