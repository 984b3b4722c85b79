package com.bilisync.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 触发器配置来源枚举
 *
 * @author bilisync
 * @since 2025-06-02
 */
public enum ConfigSourceEnum {

    CONFIG_FILE("config_file"),
    DATABASE("database");

    private final String code;

    ConfigSourceEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ConfigSourceEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ConfigSourceEnum item : ConfigSourceEnum.values()) {
            if (item.code.equalsIgnoreCase(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ConfigSource code: " + code);
    }
}
