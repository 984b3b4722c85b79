package com.bilisync.trigger.application.query;

import com.bilisync.api.dto.TaskDefinitionDTO;
import com.bilisync.api.dto.TaskExecutionDTO;
import com.bilisync.api.dto.TaskExecutionStatsDTO;
import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.domain.task.service.ExecutionTracker;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.trigger.application.common.TaskViewAssembler;
import com.bilisync.types.common.PageResult;
import com.bilisync.types.exception.ExecutionNotFoundException;
import com.bilisync.types.exception.TaskNotFoundException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务读用例：任务列表、执行历史、统计与运行中执行。
 */
@Service
public class TaskQueryService {

    private final TaskRegistry taskRegistry;
    private final ExecutionTracker executionTracker;
    private final TaskViewAssembler taskViewAssembler;

    public TaskQueryService(TaskRegistry taskRegistry,
                            ExecutionTracker executionTracker,
                            TaskViewAssembler taskViewAssembler) {
        this.taskRegistry = taskRegistry;
        this.executionTracker = executionTracker;
        this.taskViewAssembler = taskViewAssembler;
    }

    public List<TaskDefinitionDTO> listTasks() {
        return taskRegistry.list().stream()
                .map(taskViewAssembler::toDefinitionDTO)
                .collect(Collectors.toList());
    }

    public TaskDefinitionDTO getTask(String taskName) {
        TaskDefinition definition = taskRegistry.get(taskName);
        if (definition == null) {
            throw new TaskNotFoundException("Task not found. taskName=" + taskName);
        }
        return taskViewAssembler.toDefinitionDTO(definition);
    }

    public PageResult<TaskExecutionDTO> history(TaskExecutionQuery query) {
        PageResult<TaskExecutionEntity> page = executionTracker.list(query);
        List<TaskExecutionDTO> list = page.getList().stream()
                .map(taskViewAssembler::toExecutionDTO)
                .collect(Collectors.toList());
        return PageResult.of(list, page.getTotal(), page.getPage(), page.getPageSize());
    }

    public TaskExecutionDTO getExecution(String executionId) {
        return taskViewAssembler.toExecutionDTO(executionTracker.require(executionId));
    }

    public TaskExecutionStatsDTO stats(String taskName) {
        return taskViewAssembler.toStatsDTO(executionTracker.stats(taskName));
    }

    public List<TaskExecutionDTO> running() {
        return executionTracker.running().stream()
                .map(taskViewAssembler::toExecutionDTO)
                .collect(Collectors.toList());
    }

    public List<TaskExecutionDTO> runningByTaskName(String taskName) {
        return executionTracker.runningByTaskName(taskName).stream()
                .map(taskViewAssembler::toExecutionDTO)
                .collect(Collectors.toList());
    }

    public TaskExecutionDTO getRunning(String executionId) {
        TaskExecutionEntity running = executionTracker.getRunning(executionId);
        if (running == null) {
            throw new ExecutionNotFoundException("Running execution not found. executionId=" + executionId);
        }
        return taskViewAssembler.toExecutionDTO(running);
    }
}
