package com.bilisync.domain.profile.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量同步结果，作为执行记录的 result 保存。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BatchSyncResult {

    private int total;

    private int success;

    private int failed;

    private List<ItemResult> perItemResults = new ArrayList<>();

    public void addSuccess(Long mid) {
        success++;
        perItemResults.add(new ItemResult(mid, true, null));
    }

    public void addFailure(Long mid, String error) {
        failed++;
        perItemResults.add(new ItemResult(mid, false, error));
    }

    public boolean isAllFailed() {
        return total > 0 && failed == total;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemResult {

        private Long mid;

        private boolean success;

        private String error;
    }
}
