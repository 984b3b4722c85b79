package com.bilisync.domain.task.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 状态流转时一并写入的结果或错误信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionPayload {

    private Object result;

    private String error;

    private String errorType;

    public static ExecutionPayload none() {
        return new ExecutionPayload();
    }

    public static ExecutionPayload result(Object result) {
        return ExecutionPayload.builder().result(result).build();
    }

    public static ExecutionPayload error(String error, String errorType) {
        return ExecutionPayload.builder().error(error).errorType(errorType).build();
    }
}
