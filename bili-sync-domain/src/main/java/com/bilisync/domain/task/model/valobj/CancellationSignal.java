package com.bilisync.domain.task.model.valobj;

import com.bilisync.types.exception.TaskCancelledException;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 协作式取消信号。只能触发一次，首次触发的原因会被保留。
 */
public class CancellationSignal {

    public enum Reason {
        /** 调用方主动取消 */
        CALLER,
        /** 超时 */
        TIMEOUT
    }

    private final CountDownLatch latch = new CountDownLatch(1);

    private volatile Reason reason;

    /**
     * 触发取消。
     *
     * @return 本次调用是否真正触发了信号；已触发过时返回 false
     */
    public synchronized boolean cancel(Reason reason) {
        if (this.reason != null) {
            return false;
        }
        this.reason = reason == null ? Reason.CALLER : reason;
        latch.countDown();
        return true;
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public boolean isCallerCancelled() {
        return reason == Reason.CALLER;
    }

    public Reason getReason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (reason != null) {
            throw new TaskCancelledException("Task cancelled. reason=" + reason.name().toLowerCase());
        }
    }

    /**
     * 等待指定时长或直到信号触发。
     *
     * @return 等待期间信号是否已触发
     */
    public boolean await(Duration duration) throws InterruptedException {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return isCancelled();
        }
        return latch.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 可被取消的 sleep，信号触发时抛出 {@link TaskCancelledException}。
     */
    public void sleep(Duration duration) throws InterruptedException {
        await(duration);
        throwIfCancelled();
    }
}
