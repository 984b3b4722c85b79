package com.bilisync.trigger.application.common;

import com.bilisync.api.dto.CancelResultDTO;
import com.bilisync.api.dto.TaskDefinitionDTO;
import com.bilisync.api.dto.TaskExecutionDTO;
import com.bilisync.api.dto.TaskExecutionStatsDTO;
import com.bilisync.api.dto.TriggerDTO;
import com.bilisync.api.dto.TriggerScheduleStateDTO;
import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.CancelResult;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.domain.trigger.model.valobj.TriggerScheduleState;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;

/**
 * 任务与触发器视图组装：领域对象转 API DTO。
 */
@Component
public class TaskViewAssembler {

    public TaskDefinitionDTO toDefinitionDTO(TaskDefinition definition) {
        TaskDefinitionDTO dto = new TaskDefinitionDTO();
        dto.setName(definition.getName());
        dto.setDescription(definition.getDescription());
        dto.setTimeoutMs(definition.getTimeout().toMillis());
        dto.setMaxRetries(definition.getMaxRetries());
        dto.setOptionSchema(new LinkedHashMap<>(definition.getOptionSchema()));
        return dto;
    }

    public TaskExecutionDTO toExecutionDTO(TaskExecutionEntity entity) {
        if (entity == null) {
            return null;
        }
        TaskExecutionDTO dto = new TaskExecutionDTO();
        dto.setId(entity.getId());
        dto.setTaskName(entity.getTaskName());
        dto.setTriggerSource(entity.getTriggerSource() == null ? null : entity.getTriggerSource().getCode());
        dto.setTriggerName(entity.getTriggerName());
        dto.setParams(entity.getParams());
        dto.setStatus(entity.getStatus() == null ? null : entity.getStatus().getCode());
        dto.setResult(entity.getResult());
        dto.setError(entity.getError());
        dto.setErrorType(entity.getErrorType());
        dto.setRetryCount(entity.getRetryCount());
        dto.setMaxRetries(entity.getMaxRetries());
        dto.setCreatedAt(entity.getCreatedAt());
        dto.setStartedAt(entity.getStartedAt());
        dto.setFinishedAt(entity.getFinishedAt());
        dto.setDurationMs(entity.getDurationMs());
        return dto;
    }

    public TaskExecutionStatsDTO toStatsDTO(TaskExecutionStats stats) {
        TaskExecutionStatsDTO dto = new TaskExecutionStatsDTO();
        dto.setTaskName(stats.getTaskName());
        dto.setTotal(stats.getTotal());
        dto.setPending(stats.getPending());
        dto.setRunning(stats.getRunning());
        dto.setSucceeded(stats.getSucceeded());
        dto.setFailed(stats.getFailed());
        dto.setCancelled(stats.getCancelled());
        dto.setAvgDurationMs(stats.getAvgDurationMs());
        return dto;
    }

    public CancelResultDTO toCancelResultDTO(CancelResult result) {
        CancelResultDTO dto = new CancelResultDTO();
        dto.setTotal(result.getTotal());
        dto.getCancelled().addAll(result.getCancelled());
        dto.getNotFound().addAll(result.getNotFound());
        for (CancelResult.Failure failure : result.getFailed()) {
            CancelResultDTO.FailureDTO failureDTO = new CancelResultDTO.FailureDTO();
            failureDTO.setExecutionId(failure.getExecutionId());
            failureDTO.setError(failure.getCause());
            dto.getFailed().add(failureDTO);
        }
        return dto;
    }

    public TriggerDTO toTriggerDTO(TriggerConfigEntry entry, TriggerScheduleState state) {
        TriggerConfig config = entry.getConfig();
        TriggerDTO dto = new TriggerDTO();
        dto.setId(config.getId());
        dto.setName(config.getName());
        dto.setTaskName(config.getTaskName());
        dto.setCron(config.getCron());
        dto.setParams(config.getParams());
        dto.setEnabled(config.isEnabledOrDefault());
        dto.setDescription(config.getDescription());
        dto.setSource(entry.getSource() == null ? null : entry.getSource().getCode());
        dto.setScheduleState(state == null || state.getState() == null ? null : state.getState().getCode());
        dto.setCreatedAt(config.getCreatedAt());
        dto.setUpdatedAt(config.getUpdatedAt());
        return dto;
    }

    public TriggerScheduleStateDTO toStateDTO(TriggerScheduleState state) {
        TriggerScheduleStateDTO dto = new TriggerScheduleStateDTO();
        dto.setTriggerId(state.getTriggerId());
        dto.setTriggerName(state.getTriggerName());
        dto.setTaskName(state.getTaskName());
        dto.setCron(state.getCron());
        dto.setEnabled(state.getEnabled());
        dto.setState(state.getState() == null ? null : state.getState().getCode());
        dto.setLastExecutionId(state.getLastExecutionId());
        dto.setLastFiredAt(state.getLastFiredAt());
        return dto;
    }
}
