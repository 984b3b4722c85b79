package com.bilisync.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 用户资料快照类型
 *
 * @author bilisync
 * @since 2025-06-02
 */
public enum ProfileKindEnum {

    CARD("card"),
    SPACE("space");

    private final String code;

    ProfileKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static ProfileKindEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ProfileKindEnum item : ProfileKindEnum.values()) {
            if (item.code.equalsIgnoreCase(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown ProfileKind code: " + code);
    }
}
