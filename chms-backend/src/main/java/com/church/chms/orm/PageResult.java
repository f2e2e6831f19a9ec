package com.church.chms.orm;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页结果：当前页数据 + 分页信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResult<T> {

    private List<T> data;

    private Pagination pagination;

    public static <T> PageResult<T> of(List<T> data, int page, int limit, long total) {
        int pages = limit > 0 ? (int) Math.ceil((double) total / limit) : 0;
        return new PageResult<>(data, new Pagination(page, limit, total, pages));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private long total;
        private int pages;
    }
}
