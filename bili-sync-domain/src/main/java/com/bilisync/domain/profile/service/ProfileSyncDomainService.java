package com.bilisync.domain.profile.service;

import com.bilisync.domain.profile.adapter.gateway.IProfileGateway;
import com.bilisync.domain.profile.adapter.repository.IProfileSnapshotRepository;
import com.bilisync.domain.profile.model.entity.ProfileSnapshotEntity;
import com.bilisync.domain.profile.model.valobj.BatchSyncResult;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.types.enums.ProfileKindEnum;
import com.bilisync.types.enums.ResponseCode;
import com.bilisync.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 用户资料批量同步：单项失败不中断，全部失败时整批失败。
 */
@Slf4j
@Service
public class ProfileSyncDomainService {

    private final IProfileGateway profileGateway;
    private final IProfileSnapshotRepository profileSnapshotRepository;

    public ProfileSyncDomainService(IProfileGateway profileGateway, IProfileSnapshotRepository profileSnapshotRepository) {
        this.profileGateway = profileGateway;
        this.profileSnapshotRepository = profileSnapshotRepository;
    }

    /**
     * 每项开始前检查取消信号。
     *
     * @throws AppException 全部失败时抛出，消息中带首个错误
     */
    public BatchSyncResult syncBatch(ProfileKindEnum kind, List<Long> mids, CancellationSignal signal) {
        BatchSyncResult result = new BatchSyncResult();
        result.setTotal(mids == null ? 0 : mids.size());
        if (mids == null || mids.isEmpty()) {
            return result;
        }
        String firstError = null;
        for (Long mid : mids) {
            if (signal != null) {
                signal.throwIfCancelled();
            }
            try {
                syncOne(kind, mid);
                result.addSuccess(mid);
            } catch (RuntimeException ex) {
                String error = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                if (firstError == null) {
                    firstError = error;
                }
                result.addFailure(mid, error);
                log.warn("Profile sync item failed. kind={}, mid={}, error={}", kind.getCode(), mid, error);
            }
        }
        log.info("Profile sync batch finished. kind={}, total={}, success={}, failed={}",
                kind.getCode(), result.getTotal(), result.getSuccess(), result.getFailed());
        if (result.isAllFailed()) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "All " + result.getTotal() + " " + kind.getCode() + " sync items failed. firstError=" + firstError);
        }
        return result;
    }

    private void syncOne(ProfileKindEnum kind, Long mid) {
        if (mid == null || mid <= 0) {
            throw new IllegalArgumentException("Invalid mid: " + mid);
        }
        Map<String, Object> payload = kind == ProfileKindEnum.CARD
                ? profileGateway.fetchUserCard(mid)
                : profileGateway.fetchUserSpace(mid);
        profileSnapshotRepository.upsert(ProfileSnapshotEntity.builder()
                .mid(mid)
                .kind(kind)
                .payload(payload)
                .syncedAt(LocalDateTime.now())
                .build());
    }
}
