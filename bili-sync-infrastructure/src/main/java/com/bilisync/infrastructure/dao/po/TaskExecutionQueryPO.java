package com.bilisync.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 执行记录分页查询条件
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskExecutionQueryPO {

    private String taskName;

    private String status;

    private String triggerSource;

    private String triggerName;

    private LocalDateTime startedFrom;

    private LocalDateTime startedTo;

    private Integer offset;

    private Integer limit;
}
