package com.bilisync.trigger.application.command;

import com.bilisync.api.dto.CancelResultDTO;
import com.bilisync.api.dto.TaskExecuteRequestDTO;
import com.bilisync.domain.task.service.ExecutionTracker;
import com.bilisync.domain.task.service.TaskExecutor;
import com.bilisync.trigger.application.common.TaskViewAssembler;
import com.bilisync.types.enums.TriggerSourceEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 任务写用例：手动/接口执行与取消。
 */
@Slf4j
@Service
public class TaskCommandService {

    private final TaskExecutor taskExecutor;
    private final ExecutionTracker executionTracker;
    private final TaskViewAssembler taskViewAssembler;

    public TaskCommandService(TaskExecutor taskExecutor,
                              ExecutionTracker executionTracker,
                              TaskViewAssembler taskViewAssembler) {
        this.taskExecutor = taskExecutor;
        this.executionTracker = executionTracker;
        this.taskViewAssembler = taskViewAssembler;
    }

    /**
     * 异步执行，返回执行 ID
     */
    public String execute(String taskName, TriggerSourceEnum triggerSource, TaskExecuteRequestDTO request) {
        Map<String, Object> params = request == null || request.getParams() == null
                ? new HashMap<>()
                : request.getParams();
        String triggerName = request == null
                ? triggerSource.getCode()
                : StringUtils.defaultIfBlank(request.getTriggerName(), triggerSource.getCode());
        String executionId = taskExecutor.run(taskName, params, triggerSource, triggerName);
        log.info("Task execution requested. executionId={}, taskName={}, triggerSource={}",
                executionId, taskName, triggerSource.getCode());
        return executionId;
    }

    public CancelResultDTO cancelByIds(List<String> executionIds) {
        return taskViewAssembler.toCancelResultDTO(executionTracker.cancelByIds(executionIds));
    }

    public CancelResultDTO cancelByTaskNames(List<String> taskNames) {
        return taskViewAssembler.toCancelResultDTO(executionTracker.cancelByTaskNames(taskNames));
    }

    public CancelResultDTO cancelAll() {
        return taskViewAssembler.toCancelResultDTO(executionTracker.cancelAll());
    }
}
