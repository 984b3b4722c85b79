package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 任务处理超过定义的超时时间。
 */
public class TaskTimeoutException extends AppException {

    private static final long serialVersionUID = 1L;

    public TaskTimeoutException(String message) {
        super(ResponseCode.TASK_TIMEOUT.getCode(), message);
    }

    public TaskTimeoutException(String message, Throwable cause) {
        super(ResponseCode.TASK_TIMEOUT.getCode(), message, cause);
    }
}
