package com.bilisync.types.common;

/**
 * 全局常量定义类。
 *
 * @author bilisync
 * @since 2025-06-02
 */
public class Constants {

    /** 逗号分隔符 */
    public final static String SPLIT = ",";

    /** cron 触发器调度任务名前缀 */
    public final static String CRON_JOB_PREFIX = "cron_";

    /** 孤儿执行（进程重启后遗留的 pending/running）的错误类型 */
    public final static String ERROR_TYPE_ORPHANED = "OrphanedExecution";

    /** MDC 键 */
    public final static String MDC_TRACE_ID = "traceId";
    public final static String MDC_REQUEST_ID = "requestId";

}
