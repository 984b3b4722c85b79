package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 同名任务重复注册。
 */
public class DuplicateTaskException extends AppException {

    private static final long serialVersionUID = 1L;

    public DuplicateTaskException(String message) {
        super(ResponseCode.DUPLICATE_TASK.getCode(), message);
    }

    public DuplicateTaskException(String message, Throwable cause) {
        super(ResponseCode.DUPLICATE_TASK.getCode(), message, cause);
    }
}
