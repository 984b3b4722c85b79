package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 执行状态流转不在允许的状态图内。
 */
public class InvalidTransitionException extends AppException {

    private static final long serialVersionUID = 1L;

    public InvalidTransitionException(String message) {
        super(ResponseCode.INVALID_TRANSITION.getCode(), message);
    }

    public InvalidTransitionException(String message, Throwable cause) {
        super(ResponseCode.INVALID_TRANSITION.getCode(), message, cause);
    }
}
