package com.bilisync.test;

import com.bilisync.config.TaskRegistryConfig;
import com.bilisync.domain.profile.service.ProfileSyncDomainService;
import com.bilisync.domain.task.model.valobj.TaskDefinition;
import com.bilisync.domain.task.service.TaskRegistry;
import com.bilisync.trigger.task.TestTask;
import com.bilisync.trigger.task.UserCardSyncTask;
import com.bilisync.trigger.task.UserSpaceSyncTask;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.Mockito.mock;

public class TaskRegistryConfigTest {

    @Test
    public void shouldRegisterBuiltInTasksWithTheirLimits() {
        ProfileSyncDomainService service = mock(ProfileSyncDomainService.class);
        TaskRegistry registry = new TaskRegistry();
        new TaskRegistryConfig(registry, new UserCardSyncTask(service), new UserSpaceSyncTask(service)).registerTasks();

        Assertions.assertEquals(3, registry.size());
        TaskDefinition card = registry.get(UserCardSyncTask.TASK_NAME);
        TaskDefinition space = registry.get(UserSpaceSyncTask.TASK_NAME);
        TaskDefinition test = registry.get(TestTask.TASK_NAME);
        Assertions.assertEquals(Duration.ofMinutes(5), card.getTimeout());
        Assertions.assertEquals(3, card.getMaxRetries());
        Assertions.assertEquals(Duration.ofMinutes(5), space.getTimeout());
        Assertions.assertEquals(3, space.getMaxRetries());
        Assertions.assertEquals(Duration.ofSeconds(70), test.getTimeout());
        Assertions.assertEquals(0, test.getMaxRetries());
    }
}
