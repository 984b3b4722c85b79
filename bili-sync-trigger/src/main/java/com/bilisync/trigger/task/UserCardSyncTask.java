package com.bilisync.trigger.task;

import com.bilisync.domain.profile.service.ProfileSyncDomainService;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.domain.task.model.valobj.TaskHandler;
import com.bilisync.types.enums.ProfileKindEnum;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * user-card-sync：批量同步用户名片。
 */
@Component
public class UserCardSyncTask implements TaskHandler {

    public static final String TASK_NAME = "user-card-sync";

    private final ProfileSyncDomainService profileSyncDomainService;

    public UserCardSyncTask(ProfileSyncDomainService profileSyncDomainService) {
        this.profileSyncDomainService = profileSyncDomainService;
    }

    @Override
    public Object handle(Map<String, Object> params, CancellationSignal signal) {
        return profileSyncDomainService.syncBatch(ProfileKindEnum.CARD, SyncTaskParams.readMids(params), signal);
    }
}
