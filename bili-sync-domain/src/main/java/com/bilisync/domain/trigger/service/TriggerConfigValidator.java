package com.bilisync.domain.trigger.service;

import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.types.exception.ConfigValidationException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 触发器配置校验。
 * <p>
 * 只补齐缺省值（params 为空对象、enabled 为 true），不改写 name / taskName / cron / enabled / source。
 * </p>
 */
@Service
public class TriggerConfigValidator {

    public static final int NAME_MAX_LENGTH = 100;
    public static final int TASK_NAME_MAX_LENGTH = 100;
    public static final int DESCRIPTION_MAX_LENGTH = 1000;

    /**
     * 校验并返回补齐缺省值后的副本。
     *
     * @throws ConfigValidationException 列出全部不合法字段
     */
    public TriggerConfig validate(TriggerConfig raw) {
        List<String> violations = collectViolations(raw);
        if (!violations.isEmpty()) {
            String id = raw == null ? null : raw.getId();
            throw new ConfigValidationException("Invalid trigger config. id=" + id
                    + ", violations=" + String.join("; ", violations));
        }
        TriggerConfig normalized = raw.copy();
        if (normalized.getParams() == null) {
            normalized.setParams(new LinkedHashMap<>());
        }
        if (normalized.getEnabled() == null) {
            normalized.setEnabled(Boolean.TRUE);
        }
        return normalized;
    }

    public List<String> collectViolations(TriggerConfig raw) {
        List<String> violations = new ArrayList<>();
        if (raw == null) {
            violations.add("config is null");
            return violations;
        }
        if (StringUtils.isBlank(raw.getId())) {
            violations.add("id is required");
        }
        checkLength(violations, "name", raw.getName(), NAME_MAX_LENGTH);
        checkLength(violations, "taskName", raw.getTaskName(), TASK_NAME_MAX_LENGTH);
        if (StringUtils.isBlank(raw.getCron())) {
            violations.add("cron is required");
        } else if (!CronExpressionSupport.isValid(raw.getCron())) {
            violations.add("cron is not a valid expression: " + raw.getCron());
        }
        if (raw.getDescription() != null && raw.getDescription().length() > DESCRIPTION_MAX_LENGTH) {
            violations.add("description exceeds " + DESCRIPTION_MAX_LENGTH + " characters");
        }
        if (raw.getSource() == null) {
            violations.add("source is required");
        }
        return violations;
    }

    private void checkLength(List<String> violations, String field, String value, int maxLength) {
        if (StringUtils.isBlank(value)) {
            violations.add(field + " is required");
            return;
        }
        if (value.length() > maxLength) {
            violations.add(field + " exceeds " + maxLength + " characters");
        }
    }
}
