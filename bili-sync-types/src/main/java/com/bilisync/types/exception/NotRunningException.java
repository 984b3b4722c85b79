package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 对非 running 状态的执行发起取消。
 */
public class NotRunningException extends AppException {

    private static final long serialVersionUID = 1L;

    public NotRunningException(String message) {
        super(ResponseCode.NOT_RUNNING.getCode(), message);
    }

    public NotRunningException(String message, Throwable cause) {
        super(ResponseCode.NOT_RUNNING.getCode(), message, cause);
    }
}
