package com.bilisync.infrastructure.gateway;

import com.bilisync.domain.profile.adapter.gateway.IProfileGateway;
import com.bilisync.types.enums.ResponseCode;
import com.bilisync.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Map;

/**
 * 外部用户资料 HTTP 接口。
 * <p>
 * 响应格式为 {code, message, data}，code 非 0 视为失败。
 * </p>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Component
public class HttpProfileGateway implements IProfileGateway {

    private static final String CARD_PATH = "/x/web-interface/card?mid={mid}&photo=true";
    private static final String SPACE_PATH = "/x/space/acc/info?mid={mid}";
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/141.0.0.0 Safari/537.36";
    private static final ParameterizedTypeReference<Map<String, Object>> BODY_TYPE =
            new ParameterizedTypeReference<Map<String, Object>>() {};

    private final RestClient restClient;

    public HttpProfileGateway(@Value("${profile.gateway.base-url:https://api.bilibili.com}") String baseUrl,
                              @Value("${profile.gateway.timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        this.restClient = RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
                .defaultHeader(HttpHeaders.REFERER, "https://www.bilibili.com/")
                .build();
    }

    @Override
    public Map<String, Object> fetchUserCard(long mid) {
        return fetch("card", CARD_PATH, mid);
    }

    @Override
    public Map<String, Object> fetchUserSpace(long mid) {
        return fetch("space", SPACE_PATH, mid);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> fetch(String kind, String path, long mid) {
        Map<String, Object> body;
        try {
            body = restClient.get().uri(path, mid).retrieve().body(BODY_TYPE);
        } catch (RestClientException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Profile request failed. kind=" + kind + ", mid=" + mid + ", error=" + ex.getMessage(), ex);
        }
        if (body == null) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Profile response is empty. kind=" + kind + ", mid=" + mid);
        }
        Object code = body.get("code");
        if (!(code instanceof Number number) || number.intValue() != 0) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(),
                    "Profile request rejected. kind=" + kind + ", mid=" + mid + ", code=" + code
                            + ", message=" + body.get("message"));
        }
        Object data = body.get("data");
        if (!(data instanceof Map)) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Profile response has no data. kind=" + kind + ", mid=" + mid);
        }
        log.debug("Profile fetched. kind={}, mid={}", kind, mid);
        return (Map<String, Object>) data;
    }
}
