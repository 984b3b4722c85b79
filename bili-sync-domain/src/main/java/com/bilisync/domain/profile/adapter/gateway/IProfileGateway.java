package com.bilisync.domain.profile.adapter.gateway;

import java.util.Map;

/**
 * 外部用户资料接口
 */
public interface IProfileGateway {

    /**
     * 用户名片
     */
    Map<String, Object> fetchUserCard(long mid);

    /**
     * 用户空间信息
     */
    Map<String, Object> fetchUserSpace(long mid);

}
