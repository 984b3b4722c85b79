package com.bilisync.trigger.application.query;

import com.bilisync.api.dto.TriggerDTO;
import com.bilisync.api.dto.TriggerScheduleStateDTO;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.domain.trigger.service.ConfigManager;
import com.bilisync.domain.trigger.service.TriggerScheduler;
import com.bilisync.trigger.application.common.TaskViewAssembler;
import com.bilisync.types.exception.TriggerNotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 触发器读用例。
 */
@Service
public class TriggerQueryService {

    private final ConfigManager configManager;
    private final TriggerScheduler triggerScheduler;
    private final TaskViewAssembler taskViewAssembler;

    public TriggerQueryService(ConfigManager configManager,
                               TriggerScheduler triggerScheduler,
                               TaskViewAssembler taskViewAssembler) {
        this.configManager = configManager;
        this.triggerScheduler = triggerScheduler;
        this.taskViewAssembler = taskViewAssembler;
    }

    public List<TriggerDTO> listTriggers() {
        return configManager.getLoadedConfigEntries().stream()
                .map(this::toTriggerDTO)
                .collect(Collectors.toList());
    }

    public TriggerDTO getTrigger(String id) {
        TriggerConfigEntry entry = configManager.getConfigEntry(id);
        if (entry == null) {
            throw new TriggerNotFoundException("Trigger not found. triggerId=" + id);
        }
        return toTriggerDTO(entry);
    }

    public List<TriggerScheduleStateDTO> states() {
        return triggerScheduler.getStates().stream()
                .map(taskViewAssembler::toStateDTO)
                .collect(Collectors.toList());
    }

    private TriggerDTO toTriggerDTO(TriggerConfigEntry entry) {
        return taskViewAssembler.toTriggerDTO(entry, triggerScheduler.getState(entry.getId()));
    }
}
