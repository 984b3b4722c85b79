package com.bilisync.api.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量取消结果 DTO。
 */
@Data
public class CancelResultDTO {

    private Integer total;
    private List<String> cancelled = new ArrayList<>();
    private List<String> notFound = new ArrayList<>();
    private List<FailureDTO> failed = new ArrayList<>();

    @Data
    public static class FailureDTO {

        private String executionId;
        private String error;
    }
}
