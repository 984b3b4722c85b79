package com.bilisync.domain.trigger.service;

import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.support.CronExpression;

/**
 * cron 表达式工具：兼容标准 5 段写法，统一转换为 Spring 的 6 段（秒 分 时 日 月 周）。
 */
public final class CronExpressionSupport {

    private CronExpressionSupport() {
    }

    /**
     * 5 段表达式补秒位 0；6 段与 @daily 等宏原样返回。无法识别时返回 null。
     */
    public static String normalize(String cron) {
        if (StringUtils.isBlank(cron)) {
            return null;
        }
        String trimmed = cron.trim();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        String[] fields = StringUtils.split(trimmed);
        if (fields.length == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.length == 6) {
            return String.join(" ", fields);
        }
        return null;
    }

    public static boolean isValid(String cron) {
        String normalized = normalize(cron);
        return normalized != null && CronExpression.isValidExpression(normalized);
    }

    public static CronExpression parse(String cron) {
        String normalized = normalize(cron);
        if (normalized == null) {
            throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + cron);
        }
        return CronExpression.parse(normalized);
    }
}
