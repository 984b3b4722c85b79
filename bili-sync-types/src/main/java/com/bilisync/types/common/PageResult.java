package com.bilisync.types.common;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * 分页结果，所有分页查询共用此结构。
 *
 * @param <T> 列表元素类型
 * @author bilisync
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageResult<T> implements Serializable {

    private static final long serialVersionUID = -2417781902771840172L;

    private List<T> list;

    private long total;

    /** 页码，从 1 开始 */
    private int page;

    private int pageSize;

    private int totalPages;

    public static <T> PageResult<T> of(List<T> list, long total, int page, int pageSize) {
        int pages = pageSize <= 0 ? 0 : (int) ((total + pageSize - 1) / pageSize);
        return new PageResult<>(list == null ? Collections.emptyList() : list, total, page, pageSize, pages);
    }

    public static <T> PageResult<T> empty(int page, int pageSize) {
        return of(Collections.emptyList(), 0L, page, pageSize);
    }
}
