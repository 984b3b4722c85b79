package com.bilisync.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <ul>
 *   <li>taskExecutionWorker：每次执行的生命周期与重试等待</li>
 *   <li>taskHandlerWorker：处理器调用，超时后不响应取消的处理器继续占用此池线程</li>
 *   <li>triggerConfigLoader：并行加载各配置源</li>
 * </ul>
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    @Bean(name = "triggerConfigLoader")
    @ConditionalOnMissingBean(name = "triggerConfigLoader")
    public ThreadPoolExecutor triggerConfigLoader(ThreadPoolConfigProperties properties) {
        return buildExecutor(
                properties.getCorePoolSize(),
                properties.getMaxPoolSize(),
                properties.getKeepAliveTime(),
                properties.getBlockQueueSize(),
                properties.getPolicy(),
                "trigger-config-loader-");
    }

    @Bean(name = "taskExecutionWorker")
    @ConditionalOnMissingBean(name = "taskExecutionWorker")
    public ThreadPoolExecutor taskExecutionWorker(
            @Value("${task.executor.worker.core-size:8}") int coreSize,
            @Value("${task.executor.worker.max-size:16}") int maxSize,
            @Value("${task.executor.worker.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${task.executor.worker.queue-capacity:200}") int queueCapacity,
            @Value("${task.executor.worker.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${task.executor.worker.thread-name-prefix:task-exec-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    @Bean(name = "taskHandlerWorker")
    @ConditionalOnMissingBean(name = "taskHandlerWorker")
    public ThreadPoolExecutor taskHandlerWorker(
            @Value("${task.executor.handler.core-size:8}") int coreSize,
            @Value("${task.executor.handler.max-size:32}") int maxSize,
            @Value("${task.executor.handler.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${task.executor.handler.queue-capacity:200}") int queueCapacity,
            @Value("${task.executor.handler.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${task.executor.handler.thread-name-prefix:task-handler-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    private ThreadPoolExecutor buildExecutor(Integer coreSize,
                                             Integer maxSize,
                                             Long keepAliveSeconds,
                                             Integer queueCapacity,
                                             String rejectionPolicy,
                                             String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize == null ? 1 : coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize == null ? normalizedCoreSize : maxSize, normalizedCoreSize);
        long normalizedKeepAliveSeconds = Math.max(keepAliveSeconds == null ? 0L : keepAliveSeconds, 0L);
        int normalizedQueueCapacity = Math.max(queueCapacity == null ? 0 : queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                normalizedKeepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
