package com.bilisync.test.domain;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.CancelResult;
import com.bilisync.domain.task.model.valobj.RetryBackoffPolicy;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.bilisync.domain.task.model.valobj.TaskHandler;
import com.bilisync.domain.task.service.ExecutionTracker;
import com.bilisync.domain.task.service.TaskExecutor;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.test.support.InMemoryTaskExecutionRepository;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.bilisync.types.exception.TaskNotFoundException;
import com.google.common.cache.CacheBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class TaskExecutorTest {

    private ExecutorService executionWorker;
    private ExecutorService handlerWorker;
    private TaskRegistry registry;
    private ExecutionTracker tracker;
    private SimpleMeterRegistry meterRegistry;
    private TaskExecutor executor;

    @BeforeEach
    public void setUp() {
        executionWorker = Executors.newCachedThreadPool();
        handlerWorker = Executors.newCachedThreadPool();
        registry = new TaskRegistry();
        tracker = new ExecutionTracker(new InMemoryTaskExecutionRepository(),
                CacheBuilder.newBuilder().expireAfterWrite(3, TimeUnit.SECONDS).<String, TaskExecutionStats>build());
        meterRegistry = new SimpleMeterRegistry();
        executor = new TaskExecutor(registry, tracker, executionWorker, handlerWorker, RetryBackoffPolicy.none(), meterRegistry);
    }

    @AfterEach
    public void tearDown() {
        executionWorker.shutdownNow();
        handlerWorker.shutdownNow();
    }

    @Test
    public void shouldSucceedAndPassCopyOfParams() throws Exception {
        registry.register(TaskDefinition.builder().name("echo").handler((params, signal) -> {
            params.put("touched", true);
            return params.get("value");
        }).build());
        Map<String, Object> params = new HashMap<>();
        params.put("value", 42);

        TaskExecutionEntity finished = executor.execute("echo", params, TriggerSourceEnum.API, "caller")
                .get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TaskExecutionStatusEnum.SUCCEEDED, finished.getStatus());
        Assertions.assertEquals(42, finished.getResult());
        Assertions.assertEquals("caller", finished.getTriggerName());
        Assertions.assertFalse(params.containsKey("touched"));
        Assertions.assertNotNull(finished.getDurationMs());
        Assertions.assertEquals(1.0D, meterRegistry.counter("bili.task.execution.total",
                "task", "echo", "status", "succeeded").count());
    }

    @Test
    public void shouldThrowSynchronouslyForUnknownTask() {
        Assertions.assertThrows(TaskNotFoundException.class,
                () -> executor.run("missing", Map.of(), TriggerSourceEnum.MANUAL, "manual"));
    }

    @Test
    public void shouldRetryOnSameExecutionUntilSuccess() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(TaskDefinition.builder().name("flaky").maxRetries(2).handler((params, signal) -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("attempt " + attempts.get() + " failed");
            }
            return "done";
        }).build());

        TaskExecutionEntity finished = executor.execute("flaky", null, TriggerSourceEnum.MANUAL, "manual")
                .get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TaskExecutionStatusEnum.SUCCEEDED, finished.getStatus());
        Assertions.assertEquals(3, attempts.get());
        Assertions.assertEquals(2, finished.getRetryCount());
        Assertions.assertEquals("done", finished.getResult());
        Assertions.assertNull(finished.getError());
    }

    @Test
    public void shouldFailWithLastErrorWhenRetriesExhausted() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(TaskDefinition.builder().name("broken").maxRetries(1).handler((params, signal) -> {
            throw new IllegalStateException("boom " + attempts.incrementAndGet());
        }).build());

        TaskExecutionEntity finished = executor.execute("broken", null, TriggerSourceEnum.MANUAL, "manual")
                .get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TaskExecutionStatusEnum.FAILED, finished.getStatus());
        Assertions.assertEquals(2, attempts.get());
        Assertions.assertEquals("boom 2", finished.getError());
        Assertions.assertEquals("IllegalStateException", finished.getErrorType());
    }

    @Test
    public void shouldFailOnTimeoutWithoutRetry() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        registry.register(TaskDefinition.builder().name("slow").timeout(Duration.ofMillis(100)).maxRetries(3)
                .handler((params, signal) -> {
                    attempts.incrementAndGet();
                    signal.sleep(Duration.ofSeconds(5));
                    return "late";
                }).build());

        TaskExecutionEntity finished = executor.execute("slow", null, TriggerSourceEnum.CRON, "nightly")
                .get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TaskExecutionStatusEnum.FAILED, finished.getStatus());
        Assertions.assertEquals("TaskTimeoutException", finished.getErrorType());
        Assertions.assertEquals(0, finished.getRetryCount());
        Assertions.assertEquals(1, attempts.get());
    }

    @Test
    public void shouldCancelRunningExecutionCooperatively() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        registry.register(TaskDefinition.builder().name("long").maxRetries(3).handler((params, signal) -> {
            started.countDown();
            signal.sleep(Duration.ofSeconds(10));
            return "finished";
        }).build());

        CompletableFuture<TaskExecutionEntity> completion = executor.execute("long", null, TriggerSourceEnum.API, "api");
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
        List<TaskExecutionEntity> running = tracker.runningByTaskName("long");
        Assertions.assertEquals(1, running.size());

        tracker.cancel(running.get(0).getId());
        TaskExecutionEntity finished = completion.get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TaskExecutionStatusEnum.CANCELLED, finished.getStatus());
        Assertions.assertEquals("TaskCancelledException", finished.getErrorType());
        Assertions.assertEquals(0, finished.getRetryCount());
        Assertions.assertTrue(tracker.running().isEmpty());
    }

    @Test
    public void shouldRecordCancelledWhenTimeoutFollowsCallerCancel() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        registry.register(TaskDefinition.builder().name("stubborn").timeout(Duration.ofMillis(500)).maxRetries(2)
                .handler((params, signal) -> {
                    started.countDown();
                    Thread.sleep(3000L);
                    return "ignored";
                }).build());

        CompletableFuture<TaskExecutionEntity> completion = executor.execute("stubborn", null, TriggerSourceEnum.API, "api");
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
        String executionId = tracker.runningByTaskName("stubborn").get(0).getId();

        tracker.cancel(executionId);
        Assertions.assertEquals(TaskExecutionStatusEnum.RUNNING, tracker.require(executionId).getStatus());
        TaskExecutionEntity finished = completion.get(5, TimeUnit.SECONDS);

        Assertions.assertEquals(TaskExecutionStatusEnum.CANCELLED, finished.getStatus());
        Assertions.assertEquals("TaskCancelledException", finished.getErrorType());
        Assertions.assertEquals(0, finished.getRetryCount());
    }

    @Test
    public void shouldCancelOnlyRunsOfGivenTaskName() throws Exception {
        CountDownLatch started = new CountDownLatch(3);
        TaskHandler waiting = (params, signal) -> {
            started.countDown();
            signal.sleep(Duration.ofSeconds(10));
            return "finished";
        };
        registry.register(TaskDefinition.builder().name("sync").handler(waiting).build());
        registry.register(TaskDefinition.builder().name("other").handler(waiting).build());

        CompletableFuture<TaskExecutionEntity> first = executor.execute("sync", null, TriggerSourceEnum.MANUAL, "manual");
        CompletableFuture<TaskExecutionEntity> second = executor.execute("sync", null, TriggerSourceEnum.CRON, "nightly");
        CompletableFuture<TaskExecutionEntity> other = executor.execute("other", null, TriggerSourceEnum.MANUAL, "manual");
        Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));

        CancelResult result = tracker.cancelByTaskName("sync");

        Assertions.assertEquals(2, result.getCancelled().size());
        Assertions.assertEquals(TaskExecutionStatusEnum.CANCELLED, first.get(5, TimeUnit.SECONDS).getStatus());
        Assertions.assertEquals(TaskExecutionStatusEnum.CANCELLED, second.get(5, TimeUnit.SECONDS).getStatus());
        Assertions.assertFalse(other.isDone());
        String otherId = tracker.runningByTaskName("other").get(0).getId();
        Assertions.assertEquals(TaskExecutionStatusEnum.RUNNING, tracker.require(otherId).getStatus());

        tracker.cancel(otherId);
        Assertions.assertEquals(TaskExecutionStatusEnum.CANCELLED, other.get(5, TimeUnit.SECONDS).getStatus());
    }

    @Test
    public void shouldReturnExecutionIdBeforeHandlerCompletes() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        registry.register(TaskDefinition.builder().name("gate").handler((params, signal) -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).build());

        String executionId = executor.run("gate", Map.of(), TriggerSourceEnum.MANUAL, "manual");

        Assertions.assertFalse(tracker.require(executionId).isTerminal());
        release.countDown();
        long deadline = System.currentTimeMillis() + 5000L;
        while (!tracker.require(executionId).isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10L);
        }
        Assertions.assertEquals(TaskExecutionStatusEnum.SUCCEEDED, tracker.require(executionId).getStatus());
    }
}
