package com.bilisync.test.domain;

import com.bilisync.domain.task.model.entity.TaskExecutionEntity;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.domain.task.model.valobj.RetryBackoffPolicy;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.model.valobj.TaskExecutionQuery;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import com.bilisync.types.exception.DuplicateTaskException;
import com.bilisync.types.exception.InvalidTransitionException;
import com.bilisync.types.exception.TaskCancelledException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;

public class TaskModelTest {

    @Test
    public void shouldRejectDuplicateTaskAndKeepOriginal() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(TaskDefinition.builder().name("sync").description("first").handler((p, s) -> 1).build());

        Assertions.assertThrows(DuplicateTaskException.class, () -> registry.register(
                TaskDefinition.builder().name("sync").description("second").handler((p, s) -> 2).build()));
        Assertions.assertEquals(1, registry.size());
        Assertions.assertEquals("first", registry.get("sync").getDescription());
        Assertions.assertNull(registry.get("missing"));
        Assertions.assertFalse(registry.has(null));
    }

    @Test
    public void shouldListTasksInRegistrationOrder() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(TaskDefinition.builder().name("b").handler((p, s) -> null).build());
        registry.register(TaskDefinition.builder().name("a").handler((p, s) -> null).build());

        Assertions.assertEquals("b", registry.list().get(0).getName());
        Assertions.assertEquals("a", registry.list().get(1).getName());
    }

    @Test
    public void shouldDefaultDefinitionFields() {
        TaskDefinition definition = TaskDefinition.builder().name("plain").handler((p, s) -> null).build();

        Assertions.assertEquals(0, definition.getMaxRetries());
        Assertions.assertFalse(definition.hasTimeout());
        Assertions.assertTrue(definition.getOptionSchema().isEmpty());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> TaskDefinition.builder().name(" ").handler((p, s) -> null).build());
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> TaskDefinition.builder().name("x").maxRetries(-1).handler((p, s) -> null).build());
    }

    @Test
    public void shouldFollowExecutionStatusGraph() {
        TaskExecutionEntity entity = TaskExecutionEntity.pending("e-1", "sync", Map.of("k", 1),
                TriggerSourceEnum.API, "api", 2);
        LocalDateTime start = LocalDateTime.now();

        Assertions.assertThrows(InvalidTransitionException.class,
                () -> entity.transitionTo(TaskExecutionStatusEnum.SUCCEEDED, start));
        Assertions.assertEquals(TaskExecutionStatusEnum.PENDING, entity.getStatus());

        entity.transitionTo(TaskExecutionStatusEnum.RUNNING, start);
        entity.transitionTo(TaskExecutionStatusEnum.FAILED, start.plusNanos(250_000_000L));

        Assertions.assertEquals(start, entity.getStartedAt());
        Assertions.assertEquals(250L, entity.getDurationMs());
        Assertions.assertTrue(entity.isTerminal());
        Assertions.assertThrows(InvalidTransitionException.class,
                () -> entity.transitionTo(TaskExecutionStatusEnum.RUNNING, LocalDateTime.now()));
        Assertions.assertEquals(TaskExecutionStatusEnum.FAILED, entity.getStatus());
    }

    @Test
    public void shouldRecordRetryOnlyWhileRunning() {
        TaskExecutionEntity entity = TaskExecutionEntity.pending("e-2", "sync", null, null, null, 1);

        Assertions.assertEquals(TriggerSourceEnum.MANUAL, entity.getTriggerSource());
        Assertions.assertThrows(InvalidTransitionException.class,
                () -> entity.recordRetry("boom", "IllegalStateException", LocalDateTime.now()));

        entity.transitionTo(TaskExecutionStatusEnum.RUNNING, LocalDateTime.now());
        entity.recordRetry("boom", "IllegalStateException", LocalDateTime.now());

        Assertions.assertEquals(1, entity.getRetryCount());
        Assertions.assertEquals("boom", entity.getError());
    }

    @Test
    public void shouldGrowBackoffMonotonicallyUpToMax() {
        RetryBackoffPolicy policy = RetryBackoffPolicy.defaults();

        Assertions.assertEquals(Duration.ofMillis(1000), policy.delayForRetry(1));
        Assertions.assertEquals(Duration.ofMillis(2000), policy.delayForRetry(2));
        Assertions.assertEquals(Duration.ofMillis(4000), policy.delayForRetry(3));
        Duration previous = Duration.ZERO;
        for (int retry = 1; retry <= 40; retry++) {
            Duration delay = policy.delayForRetry(retry);
            Assertions.assertTrue(delay.compareTo(previous) >= 0);
            Assertions.assertTrue(delay.toMillis() <= RetryBackoffPolicy.DEFAULT_MAX_MS);
            previous = delay;
        }
        Assertions.assertEquals(Duration.ofMillis(30000), policy.delayForRetry(40));
        Assertions.assertEquals(Duration.ZERO, RetryBackoffPolicy.none().delayForRetry(3));
    }

    @Test
    public void shouldClampQueryPagingWithoutOverflow() {
        Assertions.assertEquals(40, TaskExecutionQuery.builder().page(3).pageSize(20).build().offset());
        Assertions.assertEquals(0, TaskExecutionQuery.builder().page(-5).build().offset());
        Assertions.assertEquals(TaskExecutionQuery.MAX_PAGE_SIZE,
                TaskExecutionQuery.builder().pageSize(10_000).build().resolvePageSize());

        TaskExecutionQuery farPage = TaskExecutionQuery.builder().page(Integer.MAX_VALUE).pageSize(20).build();
        Assertions.assertEquals(Integer.MAX_VALUE, farPage.offset());
    }

    @Test
    public void shouldKeepFirstCancellationReason() throws Exception {
        CancellationSignal signal = new CancellationSignal();

        Assertions.assertFalse(signal.await(Duration.ofMillis(5)));
        Assertions.assertTrue(signal.cancel(CancellationSignal.Reason.TIMEOUT));
        Assertions.assertFalse(signal.cancel(CancellationSignal.Reason.CALLER));
        Assertions.assertEquals(CancellationSignal.Reason.TIMEOUT, signal.getReason());
        Assertions.assertFalse(signal.isCallerCancelled());
        Assertions.assertThrows(TaskCancelledException.class, () -> signal.sleep(Duration.ofSeconds(5)));
    }
}
