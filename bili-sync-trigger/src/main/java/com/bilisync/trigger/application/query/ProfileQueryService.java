package com.bilisync.trigger.application.query;

import com.bilisync.domain.profile.adapter.gateway.IProfileGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 用户资料按需查询，不写快照。
 */
@Slf4j
@Service
public class ProfileQueryService {

    private final IProfileGateway profileGateway;

    public ProfileQueryService(IProfileGateway profileGateway) {
        this.profileGateway = profileGateway;
    }

    public Map<String, Object> userCard(long mid) {
        log.info("Profile lookup requested. kind=card, mid={}", mid);
        return profileGateway.fetchUserCard(mid);
    }

    public Map<String, Object> userSpace(long mid) {
        log.info("Profile lookup requested. kind=space, mid={}", mid);
        return profileGateway.fetchUserSpace(mid);
    }
}
