package com.bilisync.trigger.http;

import com.bilisync.api.dto.CancelByIdsRequestDTO;
import com.bilisync.api.dto.CancelByTaskNamesRequestDTO;
import com.bilisync.api.dto.CancelResultDTO;
import com.bilisync.api.dto.TaskDefinitionDTO;
import com.bilisync.api.dto.TaskExecuteRequestDTO;
import com.bilisync.api.dto.TaskExecutionDTO;
import com.bilisync.api.dto.TaskExecutionStatsDTO;
import com.bilisync.api.response.Response;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.trigger.application.command.TaskCommandService;
import com.bilisync.trigger.application.query.TaskQueryService;
import com.bilisync.types.common.PageResult;
import com.bilisync.types.enums.ResponseCode;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import jakarta.validation.Valid;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务执行与查询 API。
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskQueryService taskQueryService;
    private final TaskCommandService taskCommandService;

    public TaskController(TaskQueryService taskQueryService, TaskCommandService taskCommandService) {
        this.taskQueryService = taskQueryService;
        this.taskCommandService = taskCommandService;
    }

    @GetMapping
    public Response<List<TaskDefinitionDTO>> listTasks() {
        return success(taskQueryService.listTasks());
    }

    @GetMapping("/{taskName}")
    public Response<TaskDefinitionDTO> getTask(@PathVariable("taskName") String taskName) {
        return success(taskQueryService.getTask(taskName));
    }

    @PostMapping("/{taskName}/execute/manual")
    public Response<String> executeManual(@PathVariable("taskName") String taskName,
                                          @RequestBody(required = false) TaskExecuteRequestDTO request) {
        return success(taskCommandService.execute(taskName, TriggerSourceEnum.MANUAL, request));
    }

    @PostMapping("/{taskName}/execute/api")
    public Response<String> executeApi(@PathVariable("taskName") String taskName,
                                       @RequestBody(required = false) TaskExecuteRequestDTO request) {
        return success(taskCommandService.execute(taskName, TriggerSourceEnum.API, request));
    }

    @GetMapping("/executions/history")
    public Response<PageResult<TaskExecutionDTO>> history(
            @RequestParam(value = "taskName", required = false) String taskName,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "triggerSource", required = false) String triggerSource,
            @RequestParam(value = "triggerName", required = false) String triggerName,
            @RequestParam(value = "startedFrom", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startedFrom,
            @RequestParam(value = "startedTo", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime startedTo,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "pageSize", required = false) Integer pageSize) {
        TaskExecutionQuery query = TaskExecutionQuery.builder()
                .taskName(taskName)
                .status(TaskExecutionStatusEnum.fromCode(status))
                .triggerSource(TriggerSourceEnum.fromCode(triggerSource))
                .triggerName(triggerName)
                .startedFrom(startedFrom)
                .startedTo(startedTo)
                .page(page)
                .pageSize(pageSize)
                .build();
        return success(taskQueryService.history(query));
    }

    @GetMapping("/executions/stats")
    public Response<TaskExecutionStatsDTO> stats(@RequestParam(value = "taskName", required = false) String taskName) {
        return success(taskQueryService.stats(taskName));
    }

    @GetMapping("/executions/{id}")
    public Response<TaskExecutionDTO> getExecution(@PathVariable("id") String executionId) {
        return success(taskQueryService.getExecution(executionId));
    }

    @GetMapping("/running")
    public Response<List<TaskExecutionDTO>> running() {
        return success(taskQueryService.running());
    }

    @GetMapping("/running/execution/{id}")
    public Response<TaskExecutionDTO> runningExecution(@PathVariable("id") String executionId) {
        return success(taskQueryService.getRunning(executionId));
    }

    @GetMapping("/running/{taskName}")
    public Response<List<TaskExecutionDTO>> runningByTaskName(@PathVariable("taskName") String taskName) {
        return success(taskQueryService.runningByTaskName(taskName));
    }

    @DeleteMapping("/executions/cancel/ids")
    public Response<CancelResultDTO> cancelByIds(@Valid @RequestBody CancelByIdsRequestDTO request) {
        return success(taskCommandService.cancelByIds(request.getExecutionIds()));
    }

    @DeleteMapping("/executions/cancel/taskNames")
    public Response<CancelResultDTO> cancelByTaskNames(@Valid @RequestBody CancelByTaskNamesRequestDTO request) {
        return success(taskCommandService.cancelByTaskNames(request.getTaskNames()));
    }

    @DeleteMapping("/executions/cancel/all")
    public Response<CancelResultDTO> cancelAll() {
        return success(taskCommandService.cancelAll());
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
