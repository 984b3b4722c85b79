package com.bilisync.infrastructure.dao;

import com.bilisync.infrastructure.dao.po.ProfileSnapshotPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 用户资料快照 DAO
 */
@Mapper
public interface ProfileSnapshotDao {

    /**
     * INSERT ... ON CONFLICT (mid, kind) DO UPDATE
     */
    int upsert(ProfileSnapshotPO po);

    ProfileSnapshotPO selectOne(@Param("mid") Long mid, @Param("kind") String kind);
}
