package com.bilisync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 触发器配置加载线程池属性，前缀 thread.pool.executor.config。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Data
@ConfigurationProperties(prefix = "thread.pool.executor.config", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 4;

    /** 最大线程数 */
    private Integer maxPoolSize = 8;

    /** 空闲线程最大存活时间（秒） */
    private Long keepAliveTime = 10L;

    /** 阻塞队列最大容量 */
    private Integer blockQueueSize = 100;

    /**
     * 拒绝策略：AbortPolicy / DiscardPolicy / DiscardOldestPolicy / CallerRunsPolicy
     */
    private String policy = "CallerRunsPolicy";

}
