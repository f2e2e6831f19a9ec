package com.church.chms.service;

import com.church.chms.entity.ExpenseCategory;
import com.church.chms.orm.PageResult;

public interface ExpenseCategoryService {

    Long create(String categoryName);

    void update(Long categoryId, String categoryName);

    /**
     * 已被支出引用的类别不能删除
     */
    void delete(Long categoryId);

    ExpenseCategory get(Long categoryId);

    PageResult<ExpenseCategory> getAll(int page, int limit, String name);
}
