package com.bilisync.domain.task.model.valobj;

import lombok.Getter;

import java.time.Duration;

/**
 * 指数退避：delay(n) = min(max, initial * multiplier^(n-1))，n 从 1 开始。
 * multiplier 不小于 1，所以延迟随重试次数单调不减。
 */
@Getter
public class RetryBackoffPolicy {

    public static final long DEFAULT_INITIAL_MS = 1000L;
    public static final double DEFAULT_MULTIPLIER = 2.0D;
    public static final long DEFAULT_MAX_MS = 30000L;

    private final long initialDelayMs;
    private final double multiplier;
    private final long maxDelayMs;

    public RetryBackoffPolicy(long initialDelayMs, double multiplier, long maxDelayMs) {
        this.initialDelayMs = Math.max(0L, initialDelayMs);
        this.multiplier = Math.max(1.0D, multiplier);
        this.maxDelayMs = Math.max(this.initialDelayMs, maxDelayMs);
    }

    public static RetryBackoffPolicy defaults() {
        return new RetryBackoffPolicy(DEFAULT_INITIAL_MS, DEFAULT_MULTIPLIER, DEFAULT_MAX_MS);
    }

    public static RetryBackoffPolicy none() {
        return new RetryBackoffPolicy(0L, 1.0D, 0L);
    }

    public Duration delayForRetry(int retryNumber) {
        if (retryNumber < 1 || initialDelayMs == 0L) {
            return Duration.ZERO;
        }
        double delay = initialDelayMs * Math.pow(multiplier, retryNumber - 1);
        if (Double.isInfinite(delay) || delay >= maxDelayMs) {
            return Duration.ofMillis(maxDelayMs);
        }
        return Duration.ofMillis((long) delay);
    }
}
