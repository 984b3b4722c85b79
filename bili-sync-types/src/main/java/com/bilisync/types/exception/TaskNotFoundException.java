package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 按名称找不到已注册任务。
 */
public class TaskNotFoundException extends AppException {

    private static final long serialVersionUID = 1L;

    public TaskNotFoundException(String message) {
        super(ResponseCode.TASK_NOT_FOUND.getCode(), message);
    }

    public TaskNotFoundException(String message, Throwable cause) {
        super(ResponseCode.TASK_NOT_FOUND.getCode(), message, cause);
    }
}
