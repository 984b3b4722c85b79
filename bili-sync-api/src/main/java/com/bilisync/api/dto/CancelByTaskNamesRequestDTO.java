package com.bilisync.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 按任务名批量取消请求。
 */
@Data
public class CancelByTaskNamesRequestDTO {

    @NotEmpty(message = "taskNames must not be empty")
    private List<String> taskNames;
}
