package com.bilisync.config;

import com.bilisync.domain.task.model.valobj.TaskExecutionStats;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 *
 * @author bilisync
 * @since 2025-06-02
 */
@Configuration
public class GuavaConfig {

    /**
     * 执行统计缓存，key 为任务名，全部任务使用 "*"。执行结束时按任务失效。
     */
    @Bean(name = "executionStatsCache")
    public Cache<String, TaskExecutionStats> executionStatsCache(
            @Value("${task.stats.cache-ttl-seconds:3}") long ttlSeconds) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(1000)
                .build();
    }

}
