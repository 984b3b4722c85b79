package com.bilisync.types.exception;

import com.bilisync.types.enums.ResponseCode;

/**
 * 单个配置源整体加载失败，仅影响该配置源。
 */
public class ProviderLoadException extends AppException {

    private static final long serialVersionUID = 1L;

    public ProviderLoadException(String message) {
        super(ResponseCode.PROVIDER_LOAD_FAILED.getCode(), message);
    }

    public ProviderLoadException(String message, Throwable cause) {
        super(ResponseCode.PROVIDER_LOAD_FAILED.getCode(), message, cause);
    }
}
