package com.bilisync.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 触发器调度状态：unscheduled -> scheduled -> {paused, unscheduled}
 *
 * @author bilisync
 * @since 2025-06-02
 */
public enum TriggerScheduleStateEnum {

    UNSCHEDULED("unscheduled"),
    SCHEDULED("scheduled"),
    PAUSED("paused");

    private final String code;

    TriggerScheduleStateEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static TriggerScheduleStateEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TriggerScheduleStateEnum item : TriggerScheduleStateEnum.values()) {
            if (item.code.equalsIgnoreCase(code)) {
                return item;
            }
        }
        throw new IllegalArgumentException("Unknown TriggerScheduleState code: " + code);
    }
}
