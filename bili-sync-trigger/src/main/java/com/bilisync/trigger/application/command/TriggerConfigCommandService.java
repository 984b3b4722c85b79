package com.bilisync.trigger.application.command;

import com.bilisync.api.dto.TriggerCreateRequestDTO;
import com.bilisync.api.dto.TriggerDTO;
import com.bilisync.api.dto.TriggerReloadResultDTO;
import com.bilisync.api.dto.TriggerScheduleStateDTO;
import com.bilisync.api.dto.TriggerUpdateRequestDTO;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadError;
import com.bilisync.domain.trigger.model.valobj.ConfigLoadResult;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.domain.trigger.service.ConfigManager;
import com.bilisync.domain.trigger.service.TriggerScheduler;
import com.bilisync.domain.trigger.service.provider.DatabaseTriggerConfigProvider;
import com.bilisync.trigger.application.common.TaskViewAssembler;
import com.bilisync.types.enums.ConfigSourceEnum;
import com.bilisync.types.enums.ResponseCode;
import com.bilisync.types.exception.AppException;
import com.bilisync.types.exception.TaskNotFoundException;
import com.bilisync.types.exception.TriggerNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.UUID;

/**
 * 触发器写用例：增删改、启停、暂停恢复与重载。
 * <p>
 * 只有 database 来源的触发器可以修改，配置文件来源的触发器只能通过修改文件后重载变更。
 * 持久化由 database 配置源异步回写。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class TriggerConfigCommandService {

    private final ConfigManager configManager;
    private final TriggerScheduler triggerScheduler;
    private final TaskRegistry taskRegistry;
    private final TaskViewAssembler taskViewAssembler;

    public TriggerConfigCommandService(ConfigManager configManager,
                                       TriggerScheduler triggerScheduler,
                                       TaskRegistry taskRegistry,
                                       TaskViewAssembler taskViewAssembler) {
        this.configManager = configManager;
        this.triggerScheduler = triggerScheduler;
        this.taskRegistry = taskRegistry;
        this.taskViewAssembler = taskViewAssembler;
    }

    public TriggerDTO create(TriggerCreateRequestDTO request) {
        requireRegisteredTask(request.getTaskName());
        LocalDateTime now = LocalDateTime.now();
        TriggerConfig config = TriggerConfig.builder()
                .id(UUID.randomUUID().toString())
                .name(request.getName())
                .taskName(request.getTaskName())
                .cron(request.getCron())
                .params(request.getParams() == null ? new HashMap<>() : request.getParams())
                .enabled(request.getEnabled() == null ? Boolean.TRUE : request.getEnabled())
                .description(request.getDescription())
                .source(ConfigSourceEnum.DATABASE)
                .createdAt(now)
                .updatedAt(now)
                .build();
        TriggerConfigEntry added = configManager.addConfig(
                new TriggerConfigEntry(config, DatabaseTriggerConfigProvider.PROVIDER_NAME, ConfigSourceEnum.DATABASE, now));
        return toTriggerDTO(added);
    }

    public TriggerDTO update(String id, TriggerUpdateRequestDTO request) {
        TriggerConfigEntry entry = requireModifiable(id);
        TriggerConfig current = entry.getConfig();
        TriggerConfig.TriggerConfigBuilder builder = current.toBuilder().updatedAt(LocalDateTime.now());
        if (request.getCron() != null) {
            builder.cron(request.getCron());
        }
        if (request.getEnabled() != null) {
            builder.enabled(request.getEnabled());
        }
        if (request.getDescription() != null) {
            builder.description(request.getDescription());
        }
        if (request.getParams() != null) {
            builder.params(request.getParams());
        }
        return toTriggerDTO(replace(entry, builder.build()));
    }

    /**
     * 切换启用状态
     */
    public TriggerDTO toggle(String id) {
        TriggerConfigEntry entry = requireModifiable(id);
        TriggerConfig current = entry.getConfig();
        TriggerConfig toggled = current.toBuilder()
                .enabled(!current.isEnabledOrDefault())
                .updatedAt(LocalDateTime.now())
                .build();
        TriggerConfigEntry updated = replace(entry, toggled);
        log.info("Cron trigger toggled. triggerId={}, enabled={}", id, toggled.getEnabled());
        return toTriggerDTO(updated);
    }

    public void delete(String id) {
        requireModifiable(id);
        configManager.deleteConfig(id);
    }

    public TriggerScheduleStateDTO pause(String id) {
        return taskViewAssembler.toStateDTO(triggerScheduler.pause(id));
    }

    public TriggerScheduleStateDTO resume(String id) {
        return taskViewAssembler.toStateDTO(triggerScheduler.resume(id));
    }

    /**
     * 从全部配置源重新加载，调度随 reload 事件对齐
     */
    public TriggerReloadResultDTO reload() {
        ConfigLoadResult loadResult = configManager.loadAndInitialize();
        TriggerScheduler.ReconcileResult reconcileResult = triggerScheduler.getLastReconcileResult();
        TriggerReloadResultDTO dto = new TriggerReloadResultDTO();
        dto.setLoaded(configManager.getConfigCount());
        dto.setAdded(reconcileResult.added());
        dto.setRemoved(reconcileResult.removed());
        dto.setRescheduled(reconcileResult.rescheduled());
        dto.setUnchanged(reconcileResult.unchanged());
        for (ConfigLoadError error : loadResult.errors()) {
            dto.getErrors().add(error.isProviderFailure()
                    ? error.providerName() + ": " + error.message()
                    : error.providerName() + "/" + error.configId() + ": " + error.message());
        }
        dto.getWarnings().addAll(loadResult.warnings());
        log.info("Trigger configs reloaded. loaded={}, errors={}, warnings={}",
                dto.getLoaded(), dto.getErrors().size(), dto.getWarnings().size());
        return dto;
    }

    private TriggerConfigEntry replace(TriggerConfigEntry entry, TriggerConfig config) {
        return configManager.updateConfig(
                new TriggerConfigEntry(config, entry.getProviderName(), entry.getSource(), LocalDateTime.now()));
    }

    private TriggerConfigEntry requireModifiable(String id) {
        TriggerConfigEntry entry = configManager.getConfigEntry(id);
        if (entry == null) {
            throw new TriggerNotFoundException("Trigger not found. triggerId=" + id);
        }
        if (entry.getSource() != ConfigSourceEnum.DATABASE) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                    "Only database triggers can be modified. triggerId=" + id + ", source="
                            + (entry.getSource() == null ? null : entry.getSource().getCode()));
        }
        return entry;
    }

    private void requireRegisteredTask(String taskName) {
        if (!taskRegistry.has(taskName)) {
            throw new TaskNotFoundException("Task not found. taskName=" + taskName);
        }
    }

    private TriggerDTO toTriggerDTO(TriggerConfigEntry entry) {
        return taskViewAssembler.toTriggerDTO(entry, triggerScheduler.getState(entry.getId()));
    }
}
