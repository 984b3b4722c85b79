package com.bilisync.domain.task.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量取消结果，按执行 ID 归类。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CancelResult {

    private List<String> cancelled = new ArrayList<>();

    private List<String> notFound = new ArrayList<>();

    private List<Failure> failed = new ArrayList<>();

    public void addCancelled(String executionId) {
        cancelled.add(executionId);
    }

    public void addNotFound(String key) {
        notFound.add(key);
    }

    public void addFailed(String executionId, String cause) {
        failed.add(new Failure(executionId, cause));
    }

    public int getTotal() {
        return cancelled.size() + notFound.size() + failed.size();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Failure {

        private String executionId;

        private String cause;
    }
}
