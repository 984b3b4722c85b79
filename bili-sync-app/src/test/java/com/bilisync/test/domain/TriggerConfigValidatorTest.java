package com.bilisync.test.domain;

import com.bilisync.domain.trigger.model.valobj.TriggerConfig;
import com.bilisync.domain.trigger.service.CronExpressionSupport;
import com.bilisync.domain.trigger.service.TriggerConfigValidator;
import com.bilisync.types.enums.ConfigSourceEnum;
import com.bilisync.types.exception.ConfigValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class TriggerConfigValidatorTest {

    private final TriggerConfigValidator validator = new TriggerConfigValidator();

    @Test
    public void shouldNormalizeFiveFieldCron() {
        Assertions.assertEquals("0 */5 * * * *", CronExpressionSupport.normalize(" */5 * * * * "));
        Assertions.assertEquals("0 0 3 * * *", CronExpressionSupport.normalize("0 0 3 * * *"));
        Assertions.assertEquals("@daily", CronExpressionSupport.normalize("@daily"));
        Assertions.assertNull(CronExpressionSupport.normalize("1 2 3"));
        Assertions.assertNull(CronExpressionSupport.normalize(" "));
    }

    @Test
    public void shouldDetectInvalidCron() {
        Assertions.assertTrue(CronExpressionSupport.isValid("0 3 * * *"));
        Assertions.assertTrue(CronExpressionSupport.isValid("@hourly"));
        Assertions.assertFalse(CronExpressionSupport.isValid("61 * * * *"));
        Assertions.assertFalse(CronExpressionSupport.isValid("not a cron"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CronExpressionSupport.parse("* *"));
    }

    @Test
    public void shouldFillDefaultsWithoutRewritingFields() {
        TriggerConfig raw = TriggerConfig.builder()
                .id("t-1").name("nightly").taskName("user-card-sync").cron("0 3 * * *")
                .source(ConfigSourceEnum.CONFIG_FILE).build();

        TriggerConfig valid = validator.validate(raw);

        Assertions.assertTrue(valid.getEnabled());
        Assertions.assertTrue(valid.getParams().isEmpty());
        Assertions.assertEquals("0 3 * * *", valid.getCron());
        Assertions.assertNull(raw.getEnabled());
    }

    @Test
    public void shouldListEveryViolation() {
        TriggerConfig raw = TriggerConfig.builder()
                .id(" ").name("x".repeat(101)).cron("bad").build();

        List<String> violations = validator.collectViolations(raw);

        Assertions.assertTrue(violations.contains("id is required"));
        Assertions.assertTrue(violations.contains("name exceeds 100 characters"));
        Assertions.assertTrue(violations.contains("taskName is required"));
        Assertions.assertTrue(violations.contains("cron is not a valid expression: bad"));
        Assertions.assertTrue(violations.contains("source is required"));
        ConfigValidationException ex = Assertions.assertThrows(ConfigValidationException.class,
                () -> validator.validate(raw));
        Assertions.assertTrue(ex.getInfo().contains("taskName is required"));
    }

    @Test
    public void shouldRejectOversizedDescription() {
        TriggerConfig raw = TriggerConfig.builder()
                .id("t-2").name("n").taskName("task").cron("* * * * *").description("d".repeat(1001))
                .source(ConfigSourceEnum.DATABASE).build();

        Assertions.assertEquals(List.of("description exceeds 1000 characters"), validator.collectViolations(raw));
    }
}
