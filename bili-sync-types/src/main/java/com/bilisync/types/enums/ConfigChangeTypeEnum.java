package com.bilisync.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 触发器配置变更事件类型
 *
 * @author bilisync
 * @since 2025-06-02
 */
public enum ConfigChangeTypeEnum {

    ADD("add"),
    UPDATE("update"),
    DELETE("delete"),
    RELOAD("reload");

    private final String code;

    ConfigChangeTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ConfigChangeTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ConfigChangeTypeEnum item : ConfigChangeTypeEnum.values()) {
            if (item.code.equalsIgnoreCase(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ConfigChangeType code: " + code);
    }
}
