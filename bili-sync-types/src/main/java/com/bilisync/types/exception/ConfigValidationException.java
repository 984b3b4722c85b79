package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 触发器配置未通过校验。
 */
public class ConfigValidationException extends AppException {

    private static final long serialVersionUID = 1L;

    public ConfigValidationException(String message) {
        super(ResponseCode.CONFIG_VALIDATION_FAILED.getCode(), message);
    }

    public ConfigValidationException(String message, Throwable cause) {
        super(ResponseCode.CONFIG_VALIDATION_FAILED.getCode(), message, cause);
    }
}
