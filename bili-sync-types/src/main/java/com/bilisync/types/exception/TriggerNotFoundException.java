package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 触发器配置不存在。
 */
public class TriggerNotFoundException extends AppException {

    private static final long serialVersionUID = 1L;

    public TriggerNotFoundException(String message) {
        super(ResponseCode.TRIGGER_NOT_FOUND.getCode(), message);
    }

    public TriggerNotFoundException(String message, Throwable cause) {
        super(ResponseCode.TRIGGER_NOT_FOUND.getCode(), message, cause);
    }
}
