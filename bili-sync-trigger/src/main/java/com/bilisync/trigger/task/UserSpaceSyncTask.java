package com.bilisync.trigger.task;

import com.bilisync.domain.profile.service.ProfileSyncDomainService;
import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.domain.task.model.valobj.TaskHandler;
import com.bilisync.types.enums.ProfileKindEnum;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * user-space-sync：批量同步用户空间信息。
 */
@Component
public class UserSpaceSyncTask implements TaskHandler {

    public static final String TASK_NAME = "user-space-sync";

    private final ProfileSyncDomainService profileSyncDomainService;

    public UserSpaceSyncTask(ProfileSyncDomainService profileSyncDomainService) {
        this.profileSyncDomainService = profileSyncDomainService;
    }

    @Override
    public Object handle(Map<String, Object> params, CancellationSignal signal) {
        return profileSyncDomainService.syncBatch(ProfileKindEnum.SPACE, SyncTaskParams.readMids(params), signal);
    }
}
