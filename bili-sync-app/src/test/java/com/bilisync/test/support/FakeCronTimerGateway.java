package com.bilisync.test.support;

import com.bilisync.domain.trigger.adapter.gateway.ICronTimerGateway;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 手动触发的定时器：记录每次调度，测试通过 {@link ScheduledJob#tick()} 模拟 cron 到点。
 * 已取消的句柄仍可被触发，用于模拟迟到的旧定时器回调。
 */
public class FakeCronTimerGateway implements ICronTimerGateway {

    private final List<ScheduledJob> jobs = new ArrayList<>();

    @Override
    public synchronized TimerHandle schedule(String jobName, String cron, Runnable tick) {
        ScheduledJob job = new ScheduledJob(jobName, cron, tick);
        jobs.add(job);
        return job;
    }

    public synchronized List<ScheduledJob> jobs() {
        return new ArrayList<>(jobs);
    }

    public synchronized List<ScheduledJob> jobsOf(String jobName) {
        return jobs.stream().filter(job -> job.jobName.equals(jobName)).collect(Collectors.toList());
    }

    public synchronized ScheduledJob latest(String jobName) {
        List<ScheduledJob> matched = jobsOf(jobName);
        return matched.isEmpty() ? null : matched.get(matched.size() - 1);
    }

    public static final class ScheduledJob implements TimerHandle {

        private final String jobName;
        private final String cron;
        private final Runnable tick;
        private volatile boolean cancelled;

        private ScheduledJob(String jobName, String cron, Runnable tick) {
            this.jobName = jobName;
            this.cron = cron;
            this.tick = tick;
        }

        public void tick() {
            tick.run();
        }

        public String getCron() {
            return cron;
        }

        @Override
        public void cancel() {
            cancelled = true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
