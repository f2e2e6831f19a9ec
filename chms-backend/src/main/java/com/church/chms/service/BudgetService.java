package com.church.chms.service;

import com.church.chms.dto.BudgetCreateRequest;
import com.church.chms.dto.BudgetReviewRequest;
import com.church.chms.dto.BudgetUpdateRequest;
import com.church.chms.dto.BudgetView;
import com.church.chms.orm.PageResult;

public interface BudgetService {

    Long create(BudgetCreateRequest request);

    void update(Long budgetId, BudgetUpdateRequest request);

    void delete(Long budgetId);

    BudgetView get(Long budgetId);

    PageResult<BudgetView> getAll(int page, int limit, Long fiscalYearId, Long branchId, String status);

    /**
     * Draft / Rejected → Submitted
     */
    void submit(Long budgetId);

    /**
     * Submitted → Approved / Rejected
     */
    void review(Long budgetId, BudgetReviewRequest request);
}
