package com.bilisync.trigger.task;

import com.bilisync.domain.task.model.valobj.CancellationSignal;
import com.bilisync.domain.task.model.valobj.TaskHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * test-task：分片休眠，用于验证超时与取消。
 */
@Slf4j
public class TestTask implements TaskHandler {

    public static final String TASK_NAME = "test-task";

    private final int slices;
    private final Duration sliceDuration;

    public TestTask() {
        this(12, Duration.ofSeconds(5));
    }

    public TestTask(int slices, Duration sliceDuration) {
        this.slices = slices;
        this.sliceDuration = sliceDuration;
    }

    @Override
    public Object handle(Map<String, Object> params, CancellationSignal signal) throws InterruptedException {
        for (int i = 1; i <= slices; i++) {
            signal.sleep(sliceDuration);
            log.debug("Test task progress. slice={}/{}", i, slices);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("slices", slices);
        result.put("elapsedMs", sliceDuration.toMillis() * slices);
        return result;
    }
}
