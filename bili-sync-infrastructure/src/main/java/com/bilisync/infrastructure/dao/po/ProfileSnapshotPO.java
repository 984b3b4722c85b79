package com.bilisync.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户资料快照 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSnapshotPO {

    private Long mid;

    /**
     * card / space
     */
    private String kind;

    /**
     * 原始数据 (JSONB)
     */
    private String payload;

    private LocalDateTime syncedAt;
}
