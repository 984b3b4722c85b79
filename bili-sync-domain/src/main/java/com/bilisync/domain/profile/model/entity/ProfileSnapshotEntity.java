package com.bilisync.domain.profile.model.entity;

import com.bilisync.types.enums.ProfileKindEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 用户资料快照，(mid, kind) 唯一
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSnapshotEntity {

    /**
     * 用户 mid
     */
    private Long mid;

    private ProfileKindEnum kind;

    /**
     * 外部接口返回的原始数据
     */
    private Map<String, Object> payload;

    private LocalDateTime syncedAt;
}
