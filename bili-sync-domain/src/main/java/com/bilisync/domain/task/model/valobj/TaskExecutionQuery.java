package com.bilisync.domain.task.model.valobj;

import com.bilisync.types.enums.TaskExecutionStatusEnum;
import com.bilisync.types.enums.TriggerSourceEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 执行记录查询条件，所有条件可选；startedAt 区间为闭区间。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionQuery {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 200;

    private String taskName;

    private TaskExecutionStatusEnum status;

    private TriggerSourceEnum triggerSource;

    private String triggerName;

    private LocalDateTime startedFrom;

    private LocalDateTime startedTo;

    private Integer page;

    private Integer pageSize;

    public int resolvePage() {
        return page == null || page < 1 ? DEFAULT_PAGE : page;
    }

    public int resolvePageSize() {
        if (pageSize == null || pageSize < 1) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(pageSize, MAX_PAGE_SIZE);
    }

    /**
     * 超出 int 范围的偏移量截断为 Integer.MAX_VALUE，结果为空页
     */
    public int offset() {
        long offset = (long) (resolvePage() - 1) * resolvePageSize();
        return (int) Math.min(offset, Integer.MAX_VALUE);
    }
}
