package com.bilisync.domain.task.model.valobj;

import java.util.Map;

/**
 * 任务处理器。
 * <p>
 * 处理器在独立线程中执行，不会被中断；需要支持取消的处理器应在自身的检查点
 * 调用 {@link CancellationSignal#throwIfCancelled()} 或 {@link CancellationSignal#sleep}。
 * 返回值作为执行结果保存。
 * </p>
 */
@FunctionalInterface
public interface TaskHandler {

    Object handle(Map<String, Object> params, CancellationSignal signal) throws Exception;

}
