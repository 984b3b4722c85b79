package com.bilisync.infrastructure.gateway;

import com.bilisync.domain.trigger.adapter.gateway.ICronTimerGateway;
import com.bilisync.domain.trigger.service.CronExpressionSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * cron 定时器实现：cronTriggerScheduler + CronTrigger。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Component
public class SpringCronTimerGateway implements ICronTimerGateway {

    private final TaskScheduler cronTriggerScheduler;

    public SpringCronTimerGateway(@Qualifier("cronTriggerScheduler") TaskScheduler cronTriggerScheduler) {
        this.cronTriggerScheduler = cronTriggerScheduler;
    }

    @Override
    public TimerHandle schedule(String jobName, String cron, Runnable tick) {
        String normalized = CronExpressionSupport.normalize(cron);
        if (normalized == null) {
            throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + cron);
        }
        SpringTimerHandle handle = new SpringTimerHandle(jobName);
        ScheduledFuture<?> future = cronTriggerScheduler.schedule(() -> {
            if (handle.isCancelled()) {
                return;
            }
            tick.run();
        }, new CronTrigger(normalized));
        handle.bind(future);
        log.debug("Cron job scheduled. jobName={}, cron={}", jobName, normalized);
        return handle;
    }

    private static final class SpringTimerHandle implements TimerHandle {

        private final String jobName;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        private SpringTimerHandle(String jobName) {
            this.jobName = jobName;
        }

        private void bind(ScheduledFuture<?> future) {
            this.future = future;
            if (cancelled.get() && future != null) {
                future.cancel(false);
            }
        }

        @Override
        public void cancel() {
            if (!cancelled.compareAndSet(false, true)) {
                return;
            }
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
            log.debug("Cron job cancelled. jobName={}", jobName);
        }

        @Override
        public boolean isCancelled() {
            return cancelled.get();
        }
    }
}
