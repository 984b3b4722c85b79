package com.bilisync.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * 按需查询用户资料请求。
 */
@Data
public class ProfileRequestDTO {

    @NotNull(message = "mid is required")
    @Positive(message = "mid must be positive")
    private Long mid;
}
