package com.bilisync.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行触发来源枚举
 *
 * @author bilisync
 * @since 2025-06-02
 */
public enum TriggerSourceEnum {

    MANUAL("manual"),
    CRON("cron"),
    API("api");

    private final String code;

    TriggerSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TriggerSourceEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TriggerSourceEnum item : TriggerSourceEnum.values()) {
            if (item.code.equalsIgnoreCase(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown TriggerSource code: " + code);
    }
}
