package com.bilisync.domain.trigger.service;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.service.ExecutionTracker;
import com.bilisync.domain.task.service.TaskExecutor;
import com.bilisync.domain.trigger.adapter.gateway.ICronTimerGateway;
import com.bilisync.domain.trigger.model.valobj.ConfigChangeEvent;
import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.model.valobj.TriggerConfigEntry;
import com.bilisync.domain.trigger.model.valobj.TriggerScheduleState;
import com.bilisync.types.common.Constants;
import com.bilisync.types.enums.ResponseCode;
import com.bilisync.types.enums.TriggerScheduleStateEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.bilisync.types.exception.AppException;
import com.bilisync.types.exception.TaskNotFoundException;
import com.bilisync.types.exception.TriggerNotFoundException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 把已加载的触发器配置变成 cron 调度。
 * <p>
 * 每个触发器的状态：unscheduled -> scheduled -> {paused, unscheduled}。
 * 配置变更时先取消旧定时器再按新配置重新调度，不修改运行中的定时器；
 * 旧定时器迟到的触发通过句柄比对被忽略。触发器上一次触发的执行尚未结束时，本次触发跳过。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Service
public class TriggerScheduler {

    private final ConfigManager configManager;
    private final TaskExecutor taskExecutor;
    private final ExecutionTracker executionTracker;
    private final ICronTimerGateway cronTimerGateway;

    private final Object monitor = new Object();
    private final Map<String, ScheduledTrigger> triggers = new LinkedHashMap<>();
    private Runnable unsubscribe;
    private volatile ReconcileResult lastReconcileResult = new ReconcileResult(0, 0, 0, 0);

    public TriggerScheduler(ConfigManager configManager,
                            TaskExecutor taskExecutor,
                            ExecutionTracker executionTracker,
                            ICronTimerGateway cronTimerGateway) {
        this.configManager = configManager;
        this.taskExecutor = taskExecutor;
        this.executionTracker = executionTracker;
        this.cronTimerGateway = cronTimerGateway;
    }

    /**
     * 订阅配置变更并按当前配置完成首次调度
     */
    public ReconcileResult initialize() {
        synchronized (monitor) {
            if (unsubscribe == null) {
                unsubscribe = configManager.addListener(this::onConfigChange);
            }
        }
        return reconcile(configManager.getLoadedConfigs());
    }

    public void onConfigChange(ConfigChangeEvent event) {
        if (event == null || event.type() == null) {
            return;
        }
        switch (event.type()) {
            case RELOAD -> reconcile(configsOf(event.entries()));
            case ADD, UPDATE -> {
                TriggerConfigEntry entry = event.entry();
                if (entry != null) {
                    upsert(entry.getConfig());
                }
            }
            case DELETE -> {
                TriggerConfigEntry entry = event.entry();
                if (entry != null) {
                    remove(entry.getId());
                }
            }
            default -> log.debug("Ignore config change event. type={}", event.type());
        }
    }

    /**
     * 按 ID 对比当前调度与目标配置：新增调度、移除多余、变更的先取消再重建。
     */
    public ReconcileResult reconcile(List<TriggerConfig> configs) {
        int added = 0;
        int removed = 0;
        int rescheduled = 0;
        int unchanged = 0;
        synchronized (monitor) {
            Set<String> desiredIds = new HashSet<>();
            if (configs != null) {
                for (TriggerConfig config : configs) {
                    if (config == null || config.getId() == null) {
                        continue;
                    }
                    desiredIds.add(config.getId());
                    ScheduledTrigger current = triggers.get(config.getId());
                    if (current == null) {
                        place(config, false);
                        added++;
                    } else if (hasChanged(current.config, config)) {
                        replace(current, config);
                        rescheduled++;
                    } else {
                        current.config = config.copy();
                        unchanged++;
                    }
                }
            }
            for (String id : new ArrayList<>(triggers.keySet())) {
                if (!desiredIds.contains(id)) {
                    unschedule(triggers.remove(id));
                    removed++;
                }
            }
        }
        ReconcileResult result = new ReconcileResult(added, removed, rescheduled, unchanged);
        lastReconcileResult = result;
        log.info("Cron triggers reconciled. added={}, removed={}, rescheduled={}, unchanged={}",
                added, removed, rescheduled, unchanged);
        return result;
    }

    /**
     * 暂停：撤销定时器但保留触发器
     */
    public TriggerScheduleState pause(String id) {
        synchronized (monitor) {
            ScheduledTrigger trigger = require(id);
            if (trigger.state != TriggerScheduleStateEnum.SCHEDULED) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                        "Trigger is not scheduled. triggerId=" + id + ", state=" + trigger.state.getCode());
            }
            cancelTimer(trigger);
            trigger.state = TriggerScheduleStateEnum.PAUSED;
            log.info("Cron trigger paused. triggerId={}, name={}", id, trigger.config.getName());
            return trigger.snapshot();
        }
    }

    public TriggerScheduleState resume(String id) {
        synchronized (monitor) {
            ScheduledTrigger trigger = require(id);
            if (trigger.state != TriggerScheduleStateEnum.PAUSED) {
                throw new AppException(ResponseCode.ILLEGAL_PARAMETER.getCode(),
                        "Trigger is not paused. triggerId=" + id + ", state=" + trigger.state.getCode());
            }
            arm(trigger);
            log.info("Cron trigger resumed. triggerId={}, name={}", id, trigger.config.getName());
            return trigger.snapshot();
        }
    }

    /**
     * 最近一次全量对齐的结果，reload 事件触发的对齐也会记录在这里
     */
    public ReconcileResult getLastReconcileResult() {
        return lastReconcileResult;
    }

    public List<TriggerScheduleState> getStates() {
        synchronized (monitor) {
            List<TriggerScheduleState> states = new ArrayList<>(triggers.size());
            for (ScheduledTrigger trigger : triggers.values()) {
                states.add(trigger.snapshot());
            }
            return states;
        }
    }

    /**
     * 不存在返回 null
     */
    public TriggerScheduleState getState(String id) {
        synchronized (monitor) {
            ScheduledTrigger trigger = id == null ? null : triggers.get(id);
            return trigger == null ? null : trigger.snapshot();
        }
    }

    @PreDestroy
    public void shutdown() {
        synchronized (monitor) {
            if (unsubscribe != null) {
                unsubscribe.run();
                unsubscribe = null;
            }
            for (ScheduledTrigger trigger : triggers.values()) {
                cancelTimer(trigger);
                trigger.state = TriggerScheduleStateEnum.UNSCHEDULED;
            }
            triggers.clear();
        }
        log.info("Cron trigger scheduler stopped");
    }

    private void upsert(TriggerConfig config) {
        if (config == null || config.getId() == null) {
            return;
        }
        synchronized (monitor) {
            ScheduledTrigger current = triggers.get(config.getId());
            if (current == null) {
                place(config, false);
            } else if (hasChanged(current.config, config)) {
                replace(current, config);
            } else {
                current.config = config.copy();
            }
        }
    }

    private void remove(String id) {
        synchronized (monitor) {
            ScheduledTrigger trigger = id == null ? null : triggers.remove(id);
            if (trigger != null) {
                unschedule(trigger);
            }
        }
    }

    /**
     * 调用方持有 monitor
     */
    private void replace(ScheduledTrigger current, TriggerConfig config) {
        boolean keepPaused = current.state == TriggerScheduleStateEnum.PAUSED;
        unschedule(triggers.remove(current.config.getId()));
        ScheduledTrigger replacement = place(config, keepPaused);
        replacement.lastExecutionId = current.lastExecutionId;
        replacement.lastFiredAt = current.lastFiredAt;
    }

    /**
     * 调用方持有 monitor
     */
    private ScheduledTrigger place(TriggerConfig config, boolean paused) {
        ScheduledTrigger trigger = new ScheduledTrigger(config.copy());
        triggers.put(config.getId(), trigger);
        if (!config.isEnabledOrDefault()) {
            log.info("Cron trigger loaded but disabled. triggerId={}, name={}", config.getId(), config.getName());
            return trigger;
        }
        if (paused) {
            trigger.state = TriggerScheduleStateEnum.PAUSED;
            return trigger;
        }
        arm(trigger);
        return trigger;
    }

    private void arm(ScheduledTrigger trigger) {
        TriggerConfig config = trigger.config;
        try {
            trigger.handle = cronTimerGateway.schedule(Constants.CRON_JOB_PREFIX + config.getId(), config.getCron(),
                    () -> fire(trigger));
            trigger.state = TriggerScheduleStateEnum.SCHEDULED;
            log.info("Cron trigger scheduled. triggerId={}, name={}, taskName={}, cron={}",
                    config.getId(), config.getName(), config.getTaskName(), config.getCron());
        } catch (RuntimeException ex) {
            trigger.handle = null;
            trigger.state = TriggerScheduleStateEnum.UNSCHEDULED;
            log.error("Failed to schedule cron trigger. triggerId={}, cron={}, error={}",
                    config.getId(), config.getCron(), ex.getMessage());
        }
    }

    private void unschedule(ScheduledTrigger trigger) {
        if (trigger == null) {
            return;
        }
        cancelTimer(trigger);
        trigger.state = TriggerScheduleStateEnum.UNSCHEDULED;
        log.info("Cron trigger unscheduled. triggerId={}, name={}", trigger.config.getId(), trigger.config.getName());
    }

    private void cancelTimer(ScheduledTrigger trigger) {
        if (trigger.handle != null) {
            trigger.handle.cancel();
            trigger.handle = null;
        }
    }

    void fire(ScheduledTrigger trigger) {
        TriggerConfig config;
        String lastExecutionId;
        synchronized (monitor) {
            if (triggers.get(trigger.config.getId()) != trigger || trigger.state != TriggerScheduleStateEnum.SCHEDULED) {
                log.debug("Ignore stale cron tick. triggerId={}", trigger.config.getId());
                return;
            }
            config = trigger.config;
            lastExecutionId = trigger.lastExecutionId;
        }
        if (lastExecutionId != null) {
            TaskExecutionEntity last = executionTracker.get(lastExecutionId);
            if (last != null && !last.isTerminal()) {
                log.warn("Skip cron tick because previous execution is still active. triggerId={}, name={}, executionId={}",
                        config.getId(), config.getName(), lastExecutionId);
                return;
            }
        }
        try {
            String executionId = taskExecutor.run(config.getTaskName(), config.getParams(), TriggerSourceEnum.CRON, config.getName());
            synchronized (monitor) {
                trigger.lastExecutionId = executionId;
                trigger.lastFiredAt = LocalDateTime.now();
            }
            log.info("Cron trigger fired. triggerId={}, name={}, taskName={}, executionId={}",
                    config.getId(), config.getName(), config.getTaskName(), executionId);
        } catch (TaskNotFoundException ex) {
            log.warn("Cron trigger references unknown task. triggerId={}, name={}, taskName={}",
                    config.getId(), config.getName(), config.getTaskName());
        } catch (RuntimeException ex) {
            log.error("Cron trigger fire failed. triggerId={}, name={}, error={}",
                    config.getId(), config.getName(), ex.getMessage(), ex);
        }
    }

    private ScheduledTrigger require(String id) {
        ScheduledTrigger trigger = id == null ? null : triggers.get(id);
        if (trigger == null) {
            throw new TriggerNotFoundException("Trigger not found. triggerId=" + id);
        }
        return trigger;
    }

    private boolean hasChanged(TriggerConfig current, TriggerConfig next) {
        return !Objects.equals(current.getCron(), next.getCron())
                || current.isEnabledOrDefault() != next.isEnabledOrDefault()
                || !Objects.equals(current.getParams(), next.getParams())
                || !Objects.equals(current.getTaskName(), next.getTaskName())
                || !Objects.equals(current.getName(), next.getName());
    }

    private List<TriggerConfig> configsOf(List<TriggerConfigEntry> entries) {
        List<TriggerConfig> configs = new ArrayList<>(entries.size());
        for (TriggerConfigEntry entry : entries) {
            configs.add(entry.getConfig());
        }
        return configs;
    }

    public record ReconcileResult(int added, int removed, int rescheduled, int unchanged) {
    }

    static final class ScheduledTrigger {

        private TriggerConfig config;
        private TriggerScheduleStateEnum state = TriggerScheduleStateEnum.UNSCHEDULED;
        private ICronTimerGateway.TimerHandle handle;
        private String lastExecutionId;
        private LocalDateTime lastFiredAt;

        private ScheduledTrigger(TriggerConfig config) {
            this.config = config;
        }

        private TriggerScheduleState snapshot() {
            return TriggerScheduleState.builder()
                    .triggerId(config.getId())
                    .triggerName(config.getName())
                    .taskName(config.getTaskName())
                    .cron(config.getCron())
                    .enabled(config.isEnabledOrDefault())
                    .state(state)
                    .lastExecutionId(lastExecutionId)
                    .lastFiredAt(lastFiredAt)
                    .build();
        }
    }
}
