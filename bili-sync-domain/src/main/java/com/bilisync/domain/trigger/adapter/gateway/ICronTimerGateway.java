package com.bilisync.domain.trigger.adapter.gateway;

/**
 * cron 定时器。每次调度返回独立的句柄，取消后不再触发。
 */
public interface ICronTimerGateway {

    /**
     * @param jobName 调度名，用于日志
     * @param cron    5 段或 6 段 cron 表达式
     * @param tick    触发回调
     */
    TimerHandle schedule(String jobName, String cron, Runnable tick);

    interface TimerHandle {

        void cancel();

        boolean isCancelled();
    }
}
