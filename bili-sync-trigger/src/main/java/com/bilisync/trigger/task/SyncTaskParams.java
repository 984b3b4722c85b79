package com.bilisync.trigger.task;

import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 同步任务参数解析。mids 支持数字与数字字符串混排。
 */
final class SyncTaskParams {

    static final String MIDS = "mids";

    private SyncTaskParams() {
    }

    static List<Long> readMids(Map<String, Object> params) {
        Object raw = params == null ? null : params.get(MIDS);
        if (!(raw instanceof List<?> items) || items.isEmpty()) {
            throw new IllegalArgumentException("Param mids must be a non-empty array");
        }
        List<Long> mids = new ArrayList<>(items.size());
        for (Object item : items) {
            mids.add(toMid(item));
        }
        return mids;
    }

    /**
     * 非整数、超出 long 范围或无法解析的项返回 null，交给同步服务按单项失败记录
     */
    private static Long toMid(Object item) {
        if (item instanceof Long || item instanceof Integer || item instanceof Short || item instanceof Byte) {
            return ((Number) item).longValue();
        }
        try {
            if (item instanceof Number number) {
                return new BigDecimal(number.toString()).longValueExact();
            }
            if (item instanceof String text && StringUtils.isNumeric(text.trim())) {
                return Long.parseLong(text.trim());
            }
        } catch (NumberFormatException | ArithmeticException ex) {
            return null;
        }
        return null;
    }
}
