package com.bilisync.domain.profile.adapter.repository;

import com.bilisync.domain.profile.model.entity.ProfileSnapshotEntity;
import com.bilisync.types.enums.ProfileKindEnum;

/**
 * 用户资料快照仓储接口
 *
 * @author bilisync
 * @since 2025-06-02
 */
public interface IProfileSnapshotRepository {

    /**
     * 按 (mid, kind) 插入或覆盖
     */
    void upsert(ProfileSnapshotEntity entity);

    /**
     * 不存在返回 null
     */
    ProfileSnapshotEntity find(long mid, ProfileKindEnum kind);

}
