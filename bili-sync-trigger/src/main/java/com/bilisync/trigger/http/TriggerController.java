package com.bilisync.trigger.http;

import com.bilisync.api.dto.TriggerCreateRequestDTO;
import com.bilisync.api.dto.TriggerDTO;
import com.bilisync.api.dto.TriggerReloadResultDTO;
import com.bilisync.api.dto.TriggerScheduleStateDTO;
import com.bilisync.api.dto.TriggerUpdateRequestDTO;
import com.bilisync.api.response.Response;
import com.bilisync.trigger.application.command.TriggerConfigCommandService;
import com.bilisync.trigger.application.query.TriggerQueryService;
import com.bilisync.types.enums.ResponseCode;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * cron 触发器管理 API。
 */
@RestController
@RequestMapping("/api/triggers/cron")
public class TriggerController {

    private final TriggerQueryService triggerQueryService;
    private final TriggerConfigCommandService triggerConfigCommandService;

    public TriggerController(TriggerQueryService triggerQueryService,
                             TriggerConfigCommandService triggerConfigCommandService) {
        this.triggerQueryService = triggerQueryService;
        this.triggerConfigCommandService = triggerConfigCommandService;
    }

    @GetMapping
    public Response<List<TriggerDTO>> list() {
        return success(triggerQueryService.listTriggers());
    }

    @GetMapping("/states")
    public Response<List<TriggerScheduleStateDTO>> states() {
        return success(triggerQueryService.states());
    }

    @GetMapping("/{id}")
    public Response<TriggerDTO> get(@PathVariable("id") String id) {
        return success(triggerQueryService.getTrigger(id));
    }

    @PostMapping
    public Response<TriggerDTO> create(@Valid @RequestBody TriggerCreateRequestDTO request) {
        return success(triggerConfigCommandService.create(request));
    }

    @PutMapping("/{id}")
    public Response<TriggerDTO> update(@PathVariable("id") String id,
                                       @Valid @RequestBody TriggerUpdateRequestDTO request) {
        return success(triggerConfigCommandService.update(id, request));
    }

    @DeleteMapping("/{id}")
    public Response<Void> delete(@PathVariable("id") String id) {
        triggerConfigCommandService.delete(id);
        return success(null);
    }

    @PostMapping("/{id}/toggle")
    public Response<TriggerDTO> toggle(@PathVariable("id") String id) {
        return success(triggerConfigCommandService.toggle(id));
    }

    @PostMapping("/{id}/pause")
    public Response<TriggerScheduleStateDTO> pause(@PathVariable("id") String id) {
        return success(triggerConfigCommandService.pause(id));
    }

    @PostMapping("/{id}/resume")
    public Response<TriggerScheduleStateDTO> resume(@PathVariable("id") String id) {
        return success(triggerConfigCommandService.resume(id));
    }

    @PostMapping("/reload")
    public Response<TriggerReloadResultDTO> reload() {
        return success(triggerConfigCommandService.reload());
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
