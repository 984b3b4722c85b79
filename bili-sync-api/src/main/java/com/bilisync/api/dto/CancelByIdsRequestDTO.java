package com.bilisync.api.dto;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 按执行 ID 批量取消请求。
 */
@Data
public class CancelByIdsRequestDTO {

    @NotEmpty(message = "executionIds must not be empty")
    private List<String> executionIds;
}
