package com.bilisync.infrastructure.repository.profile;

import com.bilisync.domain.profile.adapter.repository.IProfileSnapshotRepository;
import com.bilisync.domain.profile.model.entity.ProfileSnapshotEntity;
import com.bilisync.infrastructure.dao.ProfileSnapshotDao;
import com.bilisync.infrastructure.dao.po.ProfileSnapshotPO;
import com.bilisync.infrastructure.util.JsonCodec;
import com.bilisync.types.enums.ProfileKindEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

/**
 * 用户资料快照仓储实现类
 */
@Repository
public class ProfileSnapshotRepositoryImpl implements IProfileSnapshotRepository {

    private final ProfileSnapshotDao profileSnapshotDao;
    private final JsonCodec jsonCodec;

    public ProfileSnapshotRepositoryImpl(ProfileSnapshotDao profileSnapshotDao, JsonCodec jsonCodec) {
        this.profileSnapshotDao = profileSnapshotDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public void upsert(ProfileSnapshotEntity entity) {
        profileSnapshotDao.upsert(ProfileSnapshotPO.builder()
                .mid(entity.getMid())
                .kind(entity.getKind().getCode())
                .payload(jsonCodec.writeValue(entity.getPayload()))
                .syncedAt(entity.getSyncedAt() == null ? LocalDateTime.now() : entity.getSyncedAt())
                .build());
    }

    @Override
    public ProfileSnapshotEntity find(long mid, ProfileKindEnum kind) {
        ProfileSnapshotPO po = profileSnapshotDao.selectOne(mid, kind.getCode());
        if (po == null) {
            return null;
        }
        return ProfileSnapshotEntity.builder()
                .mid(po.getMid())
                .kind(ProfileKindEnum.fromCode(po.getKind()))
                .payload(jsonCodec.readMap(po.getPayload()))
                .syncedAt(po.getSyncedAt())
                .build();
    }
}
