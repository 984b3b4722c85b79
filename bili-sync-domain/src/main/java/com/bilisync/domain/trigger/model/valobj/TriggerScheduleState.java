package com.bilisync.domain.trigger.model.valobj;

import com.bilisync.types.enums.TriggerScheduleStateEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 触发器调度状态快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerScheduleState {

    private String triggerId;

    private String triggerName;

    private String taskName;

    private String cron;

    private Boolean enabled;

    private TriggerScheduleStateEnum state;

    private String lastExecutionId;

    private LocalDateTime lastFiredAt;
}
