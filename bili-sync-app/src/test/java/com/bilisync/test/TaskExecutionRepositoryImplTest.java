package com.bilisync.test;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.infrastructure.dao.TaskExecutionDao;
import com.bilisync.infrastructure.dao.po.TaskExecutionPO;
import com.bilisync.infrastructure.dao.po.TaskExecutionQueryPO;
import com.bilisync.infrastructure.dao.po.TaskExecutionStatsPO;
import com.bilisync.infrastructure.repository.task.TaskExecutionRepositoryImpl;
import com.bilisync.infrastructure.util.JsonCodec;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TaskExecutionRepositoryImplTest {

    private TaskExecutionDao taskExecutionDao;
    private TaskExecutionRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        taskExecutionDao = mock(TaskExecutionDao.class);
        repository = new TaskExecutionRepositoryImpl(taskExecutionDao, new JsonCodec(new ObjectMapper()));
    }

    @Test
    public void shouldWriteParamsAndResultAsJson() {
        Map<String, Object> params = new HashMap<>();
        params.put("mids", Arrays.asList(1, 2));
        TaskExecutionEntity entity = new TaskExecutionEntity();
        entity.setId("exec-1");
        entity.setTaskName("sync_profile");
        entity.setTriggerSource(TriggerSourceEnum.API);
        entity.setTriggerName("api");
        entity.setParams(params);
        entity.setStatus(TaskExecutionStatusEnum.SUCCEEDED);
        entity.setResult(Collections.singletonMap("total", 2));
        entity.setRetryCount(0);
        entity.setMaxRetries(3);

        repository.insert(entity);

        ArgumentCaptor<TaskExecutionPO> captor = ArgumentCaptor.forClass(TaskExecutionPO.class);
        verify(taskExecutionDao).insert(captor.capture());
        TaskExecutionPO po = captor.getValue();
        Assertions.assertEquals("api", po.getTriggerSource());
        Assertions.assertEquals("succeeded", po.getStatus());
        Assertions.assertEquals("{\"mids\":[1,2]}", po.getParams());
        Assertions.assertEquals("{\"total\":2}", po.getResult());
    }

    @Test
    public void shouldStoreEmptyObjectWhenParamsMissing() {
        TaskExecutionEntity entity = new TaskExecutionEntity();
        entity.setId("exec-2");
        entity.setTaskName("test");
        entity.setStatus(TaskExecutionStatusEnum.PENDING);
        entity.setParams(null);
        when(taskExecutionDao.update(any())).thenReturn(0);

        repository.update(entity);

        ArgumentCaptor<TaskExecutionPO> captor = ArgumentCaptor.forClass(TaskExecutionPO.class);
        verify(taskExecutionDao).update(captor.capture());
        Assertions.assertEquals("{}", captor.getValue().getParams());
        Assertions.assertNull(captor.getValue().getResult());
    }

    @Test
    public void shouldMapRowBackToEntity() {
        LocalDateTime createdAt = LocalDateTime.of(2025, 6, 2, 10, 0);
        TaskExecutionPO po = TaskExecutionPO.builder()
                .id("exec-3")
                .taskName("sync_profile")
                .triggerSource("cron")
                .triggerName("trigger-1")
                .params("{\"mids\":[\"7\"]}")
                .status("failed")
                .result("[1,2]")
                .error("boom")
                .errorType("RuntimeException")
                .retryCount(2)
                .maxRetries(2)
                .createdAt(createdAt)
                .durationMs(42L)
                .build();
        when(taskExecutionDao.selectById("exec-3")).thenReturn(po);

        TaskExecutionEntity entity = repository.findById("exec-3");

        Assertions.assertEquals(TriggerSourceEnum.CRON, entity.getTriggerSource());
        Assertions.assertEquals(TaskExecutionStatusEnum.FAILED, entity.getStatus());
        Assertions.assertEquals(Collections.singletonList("7"), entity.getParams().get("mids"));
        Assertions.assertEquals(Arrays.asList(1, 2), entity.getResult());
        Assertions.assertEquals("boom", entity.getError());
        Assertions.assertEquals(createdAt, entity.getCreatedAt());
        Assertions.assertEquals(42L, entity.getDurationMs());
        Assertions.assertNull(repository.findById("missing"));
    }

    @Test
    public void shouldTranslateQueryPagingAndCodes() {
        TaskExecutionQuery query = TaskExecutionQuery.builder()
                .taskName("sync_profile")
                .status(TaskExecutionStatusEnum.RUNNING)
                .triggerSource(TriggerSourceEnum.MANUAL)
                .page(3)
                .pageSize(500)
                .build();
        when(taskExecutionDao.selectByQuery(any())).thenReturn(Collections.emptyList());

        List<TaskExecutionEntity> rows = repository.findByQuery(query);

        Assertions.assertTrue(rows.isEmpty());
        ArgumentCaptor<TaskExecutionQueryPO> captor = ArgumentCaptor.forClass(TaskExecutionQueryPO.class);
        verify(taskExecutionDao).selectByQuery(captor.capture());
        TaskExecutionQueryPO queryPO = captor.getValue();
        Assertions.assertEquals("running", queryPO.getStatus());
        Assertions.assertEquals("manual", queryPO.getTriggerSource());
        Assertions.assertEquals(TaskExecutionQuery.MAX_PAGE_SIZE, queryPO.getLimit());
        Assertions.assertEquals(2 * TaskExecutionQuery.MAX_PAGE_SIZE, queryPO.getOffset());
    }

    @Test
    public void shouldSkipDaoForEmptyStatuses() {
        Assertions.assertTrue(repository.findByStatuses(Collections.emptyList()).isEmpty());
        verify(taskExecutionDao, never()).selectByStatuses(any());
    }

    @Test
    public void shouldDefaultMissingStatsToZero() {
        TaskExecutionStatsPO po = new TaskExecutionStatsPO();
        po.setTotal(3L);
        po.setSucceeded(2L);
        when(taskExecutionDao.selectStats("sync_profile")).thenReturn(po);

        TaskExecutionStats stats = repository.stats("sync_profile");

        Assertions.assertEquals(3L, stats.getTotal());
        Assertions.assertEquals(2L, stats.getSucceeded());
        Assertions.assertEquals(0L, stats.getFailed());
        Assertions.assertEquals(0L, stats.getAvgDurationMs());
        Assertions.assertEquals("other", repository.stats("other").getTaskName());
    }
}
