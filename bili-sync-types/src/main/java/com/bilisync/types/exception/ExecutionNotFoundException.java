package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 执行记录不存在。
 */
public class ExecutionNotFoundException extends AppException {

    private static final long serialVersionUID = 1L;

    public ExecutionNotFoundException(String message) {
        super(ResponseCode.EXECUTION_NOT_FOUND.getCode(), message);
    }

    public ExecutionNotFoundException(String message, Throwable cause) {
        super(ResponseCode.EXECUTION_NOT_FOUND.getCode(), message, cause);
    }
}
