package com.bilisync.test;

import com.bilisync.domain.profile.adapter.gateway.IProfileGateway;
import com.bilisync.domain.profile.adapter.repository.IProfileSnapshotRepository;
import com.bilisync.domain.profile.model.entity.ProfileSnapshotEntity;
import com.bilisync.domain.profile.model.valobj.BatchSyncResult;
import com.bilisync.domain.profile.service.ProfileSyncDomainService;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.trigger.task.TestTask;
import com.bilisync.trigger.task.UserCardSyncTask;
import com.bilisync.trigger.task.UserSpaceSyncTask;
import com.bilisync.types.enums.ProfileKindEnum;
import com.bilisync.types.exception.AppException;
import com.bilisync.types.exception.TaskCancelledException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ProfileSyncTaskTest {

    private IProfileGateway gateway;
    private IProfileSnapshotRepository repository;
    private ProfileSyncDomainService service;

    @BeforeEach
    public void setUp() {
        gateway = mock(IProfileGateway.class);
        repository = mock(IProfileSnapshotRepository.class);
        service = new ProfileSyncDomainService(gateway, repository);
    }

    @Test
    public void shouldContinueAfterSingleItemFailure() {
        when(gateway.fetchUserCard(1L)).thenReturn(Map.of("name", "a"));
        when(gateway.fetchUserCard(2L)).thenThrow(new AppException("0001", "upstream code -404"));
        when(gateway.fetchUserCard(3L)).thenReturn(Map.of("name", "c"));

        BatchSyncResult result = service.syncBatch(ProfileKindEnum.CARD, List.of(1L, 2L, 3L), new CancellationSignal());

        Assertions.assertEquals(3, result.getTotal());
        Assertions.assertEquals(2, result.getSuccess());
        Assertions.assertEquals(1, result.getFailed());
        BatchSyncResult.ItemResult failed = result.getPerItemResults().get(1);
        Assertions.assertEquals(2L, failed.getMid());
        Assertions.assertFalse(failed.isSuccess());
        Assertions.assertEquals("upstream code -404", failed.getError());
        ArgumentCaptor<ProfileSnapshotEntity> captor = ArgumentCaptor.forClass(ProfileSnapshotEntity.class);
        verify(repository, times(2)).upsert(captor.capture());
        Assertions.assertEquals(ProfileKindEnum.CARD, captor.getAllValues().get(0).getKind());
        Assertions.assertEquals(3L, captor.getAllValues().get(1).getMid());
    }

    @Test
    public void shouldFailWholeBatchWhenEveryItemFails() {
        when(gateway.fetchUserSpace(anyLong())).thenThrow(new IllegalStateException("timeout"));

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.syncBatch(ProfileKindEnum.SPACE, List.of(5L, 6L), null));

        Assertions.assertTrue(ex.getInfo().contains("firstError=timeout"));
        verify(repository, never()).upsert(any());
    }

    @Test
    public void shouldStopAtNextItemWhenCancelled() {
        CancellationSignal signal = new CancellationSignal();
        when(gateway.fetchUserCard(1L)).thenAnswer(invocation -> {
            signal.cancel(CancellationSignal.Reason.CALLER);
            return Map.of();
        });

        Assertions.assertThrows(TaskCancelledException.class,
                () -> service.syncBatch(ProfileKindEnum.CARD, List.of(1L, 2L), signal));
        verify(gateway, never()).fetchUserCard(2L);
    }

    @Test
    public void shouldRecordNonNumericMidAsFailedItem() throws Exception {
        when(gateway.fetchUserCard(anyLong())).thenReturn(Map.of("ok", true));
        UserCardSyncTask task = new UserCardSyncTask(service);

        Object result = task.handle(Map.of("mids", Arrays.asList(7, "8", "abc")), new CancellationSignal());

        BatchSyncResult batch = (BatchSyncResult) result;
        Assertions.assertEquals(2, batch.getSuccess());
        Assertions.assertEquals(1, batch.getFailed());
        Assertions.assertNull(batch.getPerItemResults().get(2).getMid());
        verify(gateway).fetchUserCard(8L);
    }

    @Test
    public void shouldRecordOversizedAndFractionalMidsAsFailedItems() throws Exception {
        when(gateway.fetchUserCard(anyLong())).thenReturn(Map.of("ok", true));
        UserCardSyncTask task = new UserCardSyncTask(service);

        Object result = task.handle(Map.of("mids", Arrays.asList(1, "99999999999999999999", 2.5, 3.0, 4L)),
                new CancellationSignal());

        BatchSyncResult batch = (BatchSyncResult) result;
        Assertions.assertEquals(5, batch.getTotal());
        Assertions.assertEquals(3, batch.getSuccess());
        Assertions.assertEquals(2, batch.getFailed());
        Assertions.assertNull(batch.getPerItemResults().get(1).getMid());
        Assertions.assertNull(batch.getPerItemResults().get(2).getMid());
        verify(gateway).fetchUserCard(3L);
        verify(gateway, never()).fetchUserCard(2L);
    }

    @Test
    public void shouldRejectMissingMids() {
        UserSpaceSyncTask task = new UserSpaceSyncTask(service);

        Assertions.assertThrows(IllegalArgumentException.class, () -> task.handle(Map.of(), new CancellationSignal()));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> task.handle(Map.of("mids", List.of()), new CancellationSignal()));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> task.handle(Map.of("mids", "1,2"), new CancellationSignal()));
    }

    @Test
    public void shouldRunTestTaskSlicesAndHonourCancel() throws Exception {
        TestTask quick = new TestTask(3, Duration.ofMillis(1));
        @SuppressWarnings("unchecked")
        Map<String, Object> result = (Map<String, Object>) quick.handle(Map.of(), new CancellationSignal());
        Assertions.assertEquals(3, result.get("slices"));

        CancellationSignal cancelled = new CancellationSignal();
        cancelled.cancel(CancellationSignal.Reason.CALLER);
        Assertions.assertThrows(TaskCancelledException.class,
                () -> new TestTask(3, Duration.ofSeconds(5)).handle(Map.of(), cancelled));
    }
}
