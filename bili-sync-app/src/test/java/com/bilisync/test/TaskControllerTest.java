package com.bilisync.test;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.RetryBackoffPolicy;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.domain.task.service.ExecutionTracker;
import com.bilisync.domain.task.service.TaskExecutor;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.test.support.InMemoryTaskExecutionRepository;
import com.bilisync.trigger.application.command.TaskCommandService;
import com.bilisync.trigger.application.common.TaskViewAssembler;
import com.bilisync.trigger.application.query.TaskQueryService;
import com.bilisync.trigger.http.GlobalApiExceptionHandler;
import com.bilisync.trigger.http.TaskController;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.CacheBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class TaskControllerTest {

    private MockMvc mockMvc;
    private ObjectMapper objectMapper;
    private ExecutorService executionWorker;
    private ExecutorService handlerWorker;
    private ExecutionTracker tracker;
    private TaskExecutor taskExecutor;

    @BeforeEach
    public void setUp() {
        executionWorker = Executors.newCachedThreadPool();
        handlerWorker = Executors.newCachedThreadPool();
        TaskRegistry registry = new TaskRegistry();
        registry.register(TaskDefinition.builder()
                .name("echo")
                .description("returns its params")
                .timeout(Duration.ofSeconds(30))
                .maxRetries(1)
                .optionSchema(Map.of("v", "any value"))
                .handler((params, signal) -> params)
                .build());
        registry.register(TaskDefinition.builder()
                .name("blocking")
                .handler((params, signal) -> {
                    signal.sleep(Duration.ofSeconds(10));
                    return null;
                })
                .build());
        tracker = new ExecutionTracker(new InMemoryTaskExecutionRepository(),
                CacheBuilder.newBuilder().expireAfterWrite(3, TimeUnit.SECONDS).<String, TaskExecutionStats>build());
        taskExecutor = new TaskExecutor(registry, tracker, executionWorker, handlerWorker,
                RetryBackoffPolicy.none(), new SimpleMeterRegistry());
        TaskViewAssembler assembler = new TaskViewAssembler();
        TaskController controller = new TaskController(
                new TaskQueryService(registry, tracker, assembler),
                new TaskCommandService(taskExecutor, tracker, assembler));
        this.mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @AfterEach
    public void tearDown() {
        executionWorker.shutdownNow();
        handlerWorker.shutdownNow();
    }

    @Test
    public void shouldListRegisteredTasks() throws Exception {
        mockMvc.perform(get("/api/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data[0].name").value("echo"))
                .andExpect(jsonPath("$.data[0].timeoutMs").value(30000))
                .andExpect(jsonPath("$.data[0].maxRetries").value(1))
                .andExpect(jsonPath("$.data[0].optionSchema.v").value("any value"))
                .andExpect(jsonPath("$.data[1].name").value("blocking"));
    }

    @Test
    public void shouldReturnTaskNotFoundCode() throws Exception {
        mockMvc.perform(get("/api/tasks/missing"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("1002"));

        mockMvc.perform(post("/api/tasks/missing/execute/manual"))
                .andExpect(jsonPath("$.code").value("1002"));
    }

    @Test
    public void shouldExecuteViaApiAndExposeExecution() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of(
                "params", Map.of("v", 1),
                "triggerName", "ci-pipeline"));

        String body = mockMvc.perform(post("/api/tasks/echo/execute/api")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0000"))
                .andReturn().getResponse().getContentAsString();
        String executionId = objectMapper.readTree(body).path("data").asText();
        awaitTerminal(executionId);

        mockMvc.perform(get("/api/tasks/executions/" + executionId))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.status").value("succeeded"))
                .andExpect(jsonPath("$.data.triggerSource").value("api"))
                .andExpect(jsonPath("$.data.triggerName").value("ci-pipeline"))
                .andExpect(jsonPath("$.data.result.v").value(1));
    }

    @Test
    public void shouldDefaultManualTriggerName() throws Exception {
        String body = mockMvc.perform(post("/api/tasks/echo/execute/manual"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andReturn().getResponse().getContentAsString();
        String executionId = objectMapper.readTree(body).path("data").asText();
        awaitTerminal(executionId);

        Assertions.assertEquals("manual", tracker.require(executionId).getTriggerName());
        Assertions.assertEquals(TriggerSourceEnum.MANUAL, tracker.require(executionId).getTriggerSource());
    }

    @Test
    public void shouldFilterAndPageHistory() throws Exception {
        for (int i = 0; i < 3; i++) {
            awaitTerminal(taskExecutor.run("echo", Map.of(), TriggerSourceEnum.API, "batch"));
        }
        awaitTerminal(taskExecutor.run("echo", Map.of(), TriggerSourceEnum.MANUAL, "manual"));

        String body = mockMvc.perform(get("/api/tasks/executions/history")
                        .param("taskName", "echo")
                        .param("status", "succeeded")
                        .param("triggerSource", "api")
                        .param("page", "1")
                        .param("pageSize", "2"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total").value(3))
                .andExpect(jsonPath("$.data.totalPages").value(2))
                .andReturn().getResponse().getContentAsString();
        JsonNode list = objectMapper.readTree(body).path("data").path("list");
        Assertions.assertEquals(2, list.size());
        Assertions.assertEquals("batch", list.get(0).path("triggerName").asText());
    }

    @Test
    public void shouldReturnEmptyPageForPageBeyondOffsetRange() throws Exception {
        awaitTerminal(taskExecutor.run("echo", Map.of(), TriggerSourceEnum.API, "api"));

        mockMvc.perform(get("/api/tasks/executions/history")
                        .param("page", String.valueOf(Integer.MAX_VALUE))
                        .param("pageSize", "20"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.list").isEmpty());
    }

    @Test
    public void shouldRejectUnknownStatusFilter() throws Exception {
        mockMvc.perform(get("/api/tasks/executions/history").param("status", "exploded"))
                .andExpect(jsonPath("$.code").value("0002"));
        mockMvc.perform(get("/api/tasks/executions/history").param("startedFrom", "yesterday"))
                .andExpect(jsonPath("$.code").value("0002"));
    }

    @Test
    public void shouldReportStats() throws Exception {
        awaitTerminal(taskExecutor.run("echo", Map.of(), TriggerSourceEnum.API, "api"));

        mockMvc.perform(get("/api/tasks/executions/stats").param("taskName", "echo"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total").value(1))
                .andExpect(jsonPath("$.data.succeeded").value(1));
    }

    @Test
    public void shouldListAndCancelRunningExecutions() throws Exception {
        String executionId = taskExecutor.run("blocking", Map.of(), TriggerSourceEnum.API, "api");
        awaitStatus(executionId, TaskExecutionStatusEnum.RUNNING);

        mockMvc.perform(get("/api/tasks/running"))
                .andExpect(jsonPath("$.data[0].id").value(executionId));
        mockMvc.perform(get("/api/tasks/running/blocking"))
                .andExpect(jsonPath("$.data[0].status").value("running"));
        mockMvc.perform(get("/api/tasks/running/execution/" + executionId))
                .andExpect(jsonPath("$.code").value("0000"));

        String payload = objectMapper.writeValueAsString(Map.of("executionIds", List.of(executionId, "ghost")));
        mockMvc.perform(delete("/api/tasks/executions/cancel/ids")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total").value(2))
                .andExpect(jsonPath("$.data.cancelled[0]").value(executionId))
                .andExpect(jsonPath("$.data.notFound[0]").value("ghost"));

        awaitTerminal(executionId);
        Assertions.assertEquals(TaskExecutionStatusEnum.CANCELLED, tracker.require(executionId).getStatus());
        mockMvc.perform(get("/api/tasks/running/execution/" + executionId))
                .andExpect(jsonPath("$.code").value("1007"));
    }

    @Test
    public void shouldReportIdleTaskNamesOnCancel() throws Exception {
        String payload = objectMapper.writeValueAsString(Map.of("taskNames", List.of("echo")));

        mockMvc.perform(delete("/api/tasks/executions/cancel/taskNames")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.notFound[0]").value("echo"));

        mockMvc.perform(delete("/api/tasks/executions/cancel/all"))
                .andExpect(jsonPath("$.code").value("0000"))
                .andExpect(jsonPath("$.data.total").value(0));
    }

    @Test
    public void shouldRejectEmptyCancelRequest() throws Exception {
        mockMvc.perform(delete("/api/tasks/executions/cancel/ids")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"executionIds\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value("0002"))
                .andExpect(jsonPath("$.info").value("executionIds: executionIds must not be empty"));
    }

    private void awaitTerminal(String executionId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        while (System.currentTimeMillis() < deadline) {
            TaskExecutionEntity entity = tracker.get(executionId);
            if (entity != null && entity.isTerminal()) {
                return;
            }
            Thread.sleep(10L);
        }
        Assertions.fail("Execution did not finish in time. executionId=" + executionId);
    }

    private void awaitStatus(String executionId, TaskExecutionStatusEnum expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        while (System.currentTimeMillis() < deadline) {
            TaskExecutionEntity entity = tracker.get(executionId);
            if (entity != null && entity.getStatus() == expected) {
                return;
            }
            Thread.sleep(10L);
        }
        Assertions.fail("Execution did not reach " + expected.getCode() + ". executionId=" + executionId);
    }
}
