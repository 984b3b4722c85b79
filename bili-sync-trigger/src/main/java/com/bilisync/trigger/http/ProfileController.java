package com.bilisync.trigger.http;

import com.bilisync.api.dto.ProfileRequestDTO;
import com.bilisync.api.response.Response;
import com.bilisync.trigger.application.query.ProfileQueryService;
import com.bilisync.types.enums.ResponseCode;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 用户名片与空间信息的即时查询 API。
 */
@RestController
public class ProfileController {

    private final ProfileQueryService profileQueryService;

    public ProfileController(ProfileQueryService profileQueryService) {
        this.profileQueryService = profileQueryService;
    }

    @PostMapping("/user-card/info")
    public Response<Map<String, Object>> userCard(@Valid @RequestBody ProfileRequestDTO request) {
        return success(profileQueryService.userCard(request.getMid()));
    }

    @PostMapping("/user-space/info")
    public Response<Map<String, Object>> userSpace(@Valid @RequestBody ProfileRequestDTO request) {
        return success(profileQueryService.userSpace(request.getMid()));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
