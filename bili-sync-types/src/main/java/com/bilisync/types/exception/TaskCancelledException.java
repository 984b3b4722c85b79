package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 任务处理器响应取消信号后抛出，执行记为 cancelled 而非 failed。
 */
public class TaskCancelledException extends AppException {

    private static final long serialVersionUID = 1L;

    public TaskCancelledException(String message) {
        super(ResponseCode.TASK_CANCELLED.getCode(), message);
    }

    public TaskCancelledException(String message, Throwable cause) {
        super(ResponseCode.TASK_CANCELLED.getCode(), message, cause);
    }
}
