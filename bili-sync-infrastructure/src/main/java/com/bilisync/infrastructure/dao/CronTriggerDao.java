package com.bilisync.infrastructure.dao;

import com.bilisync.infrastructure.dao.po.CronTriggerPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * cron 触发器 DAO
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Mapper
public interface CronTriggerDao {

    int insert(CronTriggerPO po);

    int update(CronTriggerPO po);

    int deleteById(@Param("id") String id);

    CronTriggerPO selectById(@Param("id") String id);

    List<CronTriggerPO> selectBySource(@Param("source") String source);
}
